package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.ResourceOwnership;
import io.factorialsystems.federationserver.model.Update;
import io.factorialsystems.federationserver.model.UpdateType;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface UpdateMapper {

    @Select("""
        <script>
        SELECT up.*, u.username AS created_by_username
        FROM updates up
        LEFT JOIN users u ON u.id = up.created_by
        <where>
            <if test="type != null">up.type = #{type}</if>
        </where>
        ORDER BY up.created_at DESC
        </script>
        """)
    @Results(id = "updateResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "type", column = "type"),
        @Result(property = "title", column = "title"),
        @Result(property = "content", column = "content"),
        @Result(property = "imageUrl", column = "image_url"),
        @Result(property = "redirectUrl", column = "redirect_url"),
        @Result(property = "createdById", column = "created_by"),
        @Result(property = "createdBy.id", column = "created_by"),
        @Result(property = "createdBy.username", column = "created_by_username"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<Update> findAll(@Param("type") UpdateType type);

    @Select("""
        SELECT up.*, u.username AS created_by_username
        FROM updates up
        LEFT JOIN users u ON u.id = up.created_by
        WHERE up.id = #{id}
        """)
    @ResultMap("updateResult")
    Update findById(@Param("id") String id);

    @Select("SELECT id, created_by FROM updates WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "created_by")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Insert("""
        INSERT INTO updates (id, type, title, content, image_url, redirect_url, created_by, created_at, updated_at)
        VALUES (#{id}, #{type}, #{title}, #{content}, #{imageUrl}, #{redirectUrl}, #{createdById}, #{createdAt}, #{updatedAt})
        """)
    int insert(Update update);

    @org.apache.ibatis.annotations.Update("""
        UPDATE updates SET
            type = #{type},
            title = #{title},
            content = #{content},
            image_url = #{imageUrl},
            redirect_url = #{redirectUrl},
            updated_at = #{updatedAt}
        WHERE id = #{id}
        """)
    int update(Update update);

    @Delete("DELETE FROM updates WHERE id = #{id}")
    int delete(@Param("id") String id);
}
