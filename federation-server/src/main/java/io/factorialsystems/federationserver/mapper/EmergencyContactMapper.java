package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.EmergencyContact;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface EmergencyContactMapper {

    @Select("SELECT * FROM emergency_contacts ORDER BY category, name")
    @Results(id = "emergencyContactResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "name", column = "name"),
        @Result(property = "number", column = "number"),
        @Result(property = "category", column = "category"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<EmergencyContact> findAll();

    @Select("SELECT * FROM emergency_contacts WHERE id = #{id}")
    @ResultMap("emergencyContactResult")
    EmergencyContact findById(@Param("id") String id);

    @Select("SELECT EXISTS (SELECT 1 FROM emergency_contacts WHERE id = #{id})")
    boolean exists(@Param("id") String id);

    @Insert("INSERT INTO emergency_contacts (id, name, number, category, created_at, updated_at) " +
            "VALUES (#{id}, #{name}, #{number}, #{category}, #{createdAt}, #{updatedAt})")
    int insert(EmergencyContact contact);

    @Update("UPDATE emergency_contacts SET name = #{name}, number = #{number}, category = #{category}, " +
            "updated_at = #{updatedAt} WHERE id = #{id}")
    int update(EmergencyContact contact);

    @Delete("DELETE FROM emergency_contacts WHERE id = #{id}")
    int delete(@Param("id") String id);
}
