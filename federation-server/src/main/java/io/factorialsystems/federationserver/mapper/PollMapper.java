package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.Poll;
import io.factorialsystems.federationserver.model.ResourceOwnership;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface PollMapper {

    @Select("""
        SELECT p.*, u.username AS created_by_username
        FROM polls p
        LEFT JOIN users u ON u.id = p.created_by
        ORDER BY p.created_at DESC
        """)
    @Results(id = "pollResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "question", column = "question"),
        @Result(property = "options", column = "options",
                typeHandler = io.factorialsystems.federationserver.typehandler.PollOptionListTypeHandler.class),
        @Result(property = "expiresAt", column = "expires_at"),
        @Result(property = "votedBy", column = "voted_by",
                typeHandler = io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler.class),
        @Result(property = "createdById", column = "created_by"),
        @Result(property = "createdBy.id", column = "created_by"),
        @Result(property = "createdBy.username", column = "created_by_username"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<Poll> findAll();

    /**
     * Polls still open at {@code now} that the given user has not voted on.
     */
    @Select("""
        SELECT p.*, u.username AS created_by_username
        FROM polls p
        LEFT JOIN users u ON u.id = p.created_by
        WHERE p.expires_at > #{now}
          AND NOT (#{userId} = ANY(p.voted_by))
        ORDER BY p.created_at DESC
        """)
    @ResultMap("pollResult")
    List<Poll> findOpenForUser(@Param("userId") String userId, @Param("now") OffsetDateTime now);

    @Select("""
        SELECT p.*, u.username AS created_by_username
        FROM polls p
        LEFT JOIN users u ON u.id = p.created_by
        WHERE p.id = #{id}
        """)
    @ResultMap("pollResult")
    Poll findById(@Param("id") String id);

    @Select("SELECT id, created_by FROM polls WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "created_by")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Insert("""
        INSERT INTO polls (id, question, options, expires_at, voted_by, created_by, created_at, updated_at)
        VALUES (
            #{id}, #{question},
            #{options, typeHandler=io.factorialsystems.federationserver.typehandler.PollOptionListTypeHandler}::jsonb,
            #{expiresAt},
            #{votedBy, typeHandler=io.factorialsystems.federationserver.typehandler.StringArrayTypeHandler},
            #{createdById}, #{createdAt}, #{updatedAt}
        )
        """)
    int insert(Poll poll);

    /**
     * Records one vote in a single statement. Matches no row when the poll is missing or expired,
     * the user already voted, or the option index is out of range.
     *
     * @return rows affected, 0 or 1
     */
    @Update("""
        UPDATE polls SET
            options = jsonb_set(
                options,
                ARRAY[#{optionIndex}::text, 'votes'],
                to_jsonb(COALESCE((options -> #{optionIndex} ->> 'votes')::int, 0) + 1)
            ),
            voted_by = array_append(voted_by, #{userId}::text),
            updated_at = #{now}
        WHERE id = #{pollId}
          AND expires_at > #{now}
          AND NOT (#{userId} = ANY(voted_by))
          AND #{optionIndex} >= 0
          AND #{optionIndex} < jsonb_array_length(options)
        """)
    int recordVote(@Param("pollId") String pollId,
                   @Param("optionIndex") int optionIndex,
                   @Param("userId") String userId,
                   @Param("now") OffsetDateTime now);

    @Delete("DELETE FROM polls WHERE id = #{id}")
    int delete(@Param("id") String id);
}
