package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.Industry;
import io.factorialsystems.federationserver.model.ResourceOwnership;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface IndustryMapper {

    @Select("""
        SELECT i.*, u.username AS owner_username
        FROM industries i
        LEFT JOIN users u ON u.id = i.owner_id
        ORDER BY i.created_at DESC
        """)
    @Results(id = "industryResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "name", column = "name"),
        @Result(property = "description", column = "description"),
        @Result(property = "products", column = "products",
                typeHandler = io.factorialsystems.federationserver.typehandler.ProductListTypeHandler.class),
        @Result(property = "materials", column = "materials",
                typeHandler = io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler.class),
        @Result(property = "gstInfo", column = "gst_info"),
        @Result(property = "contactNumber", column = "contact_number"),
        @Result(property = "vacancy", column = "vacancy",
                typeHandler = io.factorialsystems.federationserver.typehandler.VacancyTypeHandler.class),
        @Result(property = "images", column = "images",
                typeHandler = io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler.class),
        @Result(property = "ownerId", column = "owner_id"),
        @Result(property = "owner.id", column = "owner_id"),
        @Result(property = "owner.username", column = "owner_username"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<Industry> findAll();

    @Select("""
        SELECT i.*, u.username AS owner_username
        FROM industries i
        LEFT JOIN users u ON u.id = i.owner_id
        WHERE i.id = #{id}
        """)
    @ResultMap("industryResult")
    Industry findById(@Param("id") String id);

    @Select("SELECT id, owner_id FROM industries WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "owner_id")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Select("SELECT COUNT(*) FROM industries WHERE LOWER(name) = LOWER(#{name}) AND (#{excludeId}::varchar IS NULL OR id <> #{excludeId})")
    int countByName(@Param("name") String name, @Param("excludeId") String excludeId);

    @Insert("""
        INSERT INTO industries (
            id, name, description, products, materials, gst_info, contact_number,
            vacancy, images, owner_id, created_at, updated_at
        ) VALUES (
            #{id}, #{name}, #{description},
            #{products, typeHandler=io.factorialsystems.federationserver.typehandler.ProductListTypeHandler}::jsonb,
            #{materials, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            #{gstInfo}, #{contactNumber},
            #{vacancy, typeHandler=io.factorialsystems.federationserver.typehandler.VacancyTypeHandler}::jsonb,
            #{images, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            #{ownerId}, #{createdAt}, #{updatedAt}
        )
        """)
    int insert(Industry industry);

    @Update("""
        UPDATE industries SET
            name = #{name},
            description = #{description},
            products = #{products, typeHandler=io.factorialsystems.federationserver.typehandler.ProductListTypeHandler}::jsonb,
            materials = #{materials, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            gst_info = #{gstInfo},
            contact_number = #{contactNumber},
            vacancy = #{vacancy, typeHandler=io.factorialsystems.federationserver.typehandler.VacancyTypeHandler}::jsonb,
            images = #{images, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            updated_at = #{updatedAt}
        WHERE id = #{id}
        """)
    int update(Industry industry);

    @Delete("DELETE FROM industries WHERE id = #{id}")
    int delete(@Param("id") String id);
}
