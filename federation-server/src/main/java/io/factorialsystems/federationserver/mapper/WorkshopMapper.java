package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.ResourceOwnership;
import io.factorialsystems.federationserver.model.Workshop;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface WorkshopMapper {

    @Select("""
        SELECT w.*, u.username AS created_by_username
        FROM workshops w
        LEFT JOIN users u ON u.id = w.created_by
        ORDER BY w.date ASC
        """)
    @Results(id = "workshopResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "title", column = "title"),
        @Result(property = "description", column = "description"),
        @Result(property = "date", column = "date"),
        @Result(property = "location", column = "location"),
        @Result(property = "capacity", column = "capacity"),
        @Result(property = "registeredUsers", column = "registered_users",
                typeHandler = io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler.class),
        @Result(property = "createdById", column = "created_by"),
        @Result(property = "createdBy.id", column = "created_by"),
        @Result(property = "createdBy.username", column = "created_by_username"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<Workshop> findAll();

    @Select("""
        SELECT w.*, u.username AS created_by_username
        FROM workshops w
        LEFT JOIN users u ON u.id = w.created_by
        WHERE w.id = #{id}
        """)
    @ResultMap("workshopResult")
    Workshop findById(@Param("id") String id);

    @Select("SELECT id, created_by FROM workshops WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "created_by")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Insert("""
        INSERT INTO workshops (id, title, description, date, location, capacity, registered_users, created_by, created_at, updated_at)
        VALUES (
            #{id}, #{title}, #{description}, #{date}, #{location}, #{capacity},
            #{registeredUsers, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            #{createdById}, #{createdAt}, #{updatedAt}
        )
        """)
    int insert(Workshop workshop);

    /**
     * Updates the editable fields. Capacity is only lowered while it still covers the current registrations.
     */
    @Update("""
        UPDATE workshops SET
            title = #{title},
            description = #{description},
            date = #{date},
            location = #{location},
            capacity = #{capacity},
            updated_at = #{updatedAt}
        WHERE id = #{id}
          AND cardinality(registered_users) <= #{capacity}
        """)
    int update(Workshop workshop);

    /**
     * Adds the user to the registration set when not already present and a seat is free.
     *
     * @return rows affected, 0 or 1
     */
    @Update("""
        UPDATE workshops SET
            registered_users = array_append(registered_users, #{userId}::text),
            updated_at = #{now}
        WHERE id = #{workshopId}
          AND NOT (#{userId} = ANY(registered_users))
          AND cardinality(registered_users) < capacity
        """)
    int register(@Param("workshopId") String workshopId,
                 @Param("userId") String userId,
                 @Param("now") OffsetDateTime now);

    @Delete("DELETE FROM workshops WHERE id = #{id}")
    int delete(@Param("id") String id);
}
