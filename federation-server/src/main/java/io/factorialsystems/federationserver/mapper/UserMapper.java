package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.User;
import io.factorialsystems.federationserver.model.UserRole;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface UserMapper {

    @Select("SELECT * FROM users WHERE id = #{id}")
    @Results(id = "userResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "username", column = "username"),
        @Result(property = "email", column = "email"),
        @Result(property = "password", column = "password"),
        @Result(property = "role", column = "role"),
        @Result(property = "status", column = "status"),
        @Result(property = "expiryDate", column = "expiry_date"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    User findById(@Param("id") String id);

    @Select("SELECT * FROM users WHERE email = #{email}")
    @ResultMap("userResult")
    User findByEmail(@Param("email") String email);

    @Select("SELECT * FROM users WHERE username = #{username}")
    @ResultMap("userResult")
    User findByUsername(@Param("username") String username);

    @Select("SELECT * FROM users ORDER BY created_at DESC")
    @ResultMap("userResult")
    List<User> findAll();

    @Select("SELECT COUNT(*) FROM users WHERE role = #{role}")
    int countByRole(@Param("role") UserRole role);

    @Insert("INSERT INTO users (id, username, email, password, role, status, expiry_date, created_at, updated_at) " +
            "VALUES (#{id}, #{username}, #{email}, #{password}, #{role}, #{status}, #{expiryDate}, #{createdAt}, #{updatedAt})")
    int insert(User user);

    /**
     * Updates profile and membership fields. The stored password hash is left untouched.
     */
    @Update("UPDATE users SET username = #{username}, email = #{email}, role = #{role}, status = #{status}, " +
            "expiry_date = #{expiryDate}, updated_at = #{updatedAt} WHERE id = #{id}")
    int update(User user);

    @Delete("DELETE FROM users WHERE id = #{id}")
    int delete(@Param("id") String id);

    /**
     * Flips every lapsed active account to inactive.
     *
     * @return ids of the accounts that changed
     */
    @Select("UPDATE users SET status = 'INACTIVE', updated_at = #{now} " +
            "WHERE status = 'ACTIVE' AND expiry_date < #{now} RETURNING id")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    List<String> deactivateExpired(@Param("now") OffsetDateTime now);
}
