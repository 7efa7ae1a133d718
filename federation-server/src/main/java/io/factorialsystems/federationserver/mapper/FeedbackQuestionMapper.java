package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.FeedbackQuestion;
import io.factorialsystems.federationserver.model.ResourceOwnership;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface FeedbackQuestionMapper {

    @Select("""
        SELECT q.*, u.username AS created_by_username, u.email AS created_by_email
        FROM feedback_questions q
        LEFT JOIN users u ON u.id = q.created_by
        ORDER BY q.created_at DESC
        """)
    @Results(id = "feedbackQuestionResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "title", column = "title"),
        @Result(property = "description", column = "description"),
        @Result(property = "category", column = "category"),
        @Result(property = "isActive", column = "is_active"),
        @Result(property = "expiresAt", column = "expires_at"),
        @Result(property = "createdById", column = "created_by"),
        @Result(property = "createdBy.id", column = "created_by"),
        @Result(property = "createdBy.username", column = "created_by_username"),
        @Result(property = "createdBy.email", column = "created_by_email"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<FeedbackQuestion> findAll();

    @Select("""
        SELECT q.*
        FROM feedback_questions q
        WHERE q.is_active = TRUE
          AND (q.expires_at IS NULL OR q.expires_at > #{now})
        ORDER BY q.created_at DESC
        """)
    @ResultMap("feedbackQuestionResult")
    List<FeedbackQuestion> findOpen(@Param("now") OffsetDateTime now);

    @Select("SELECT * FROM feedback_questions WHERE id = #{id}")
    @ResultMap("feedbackQuestionResult")
    FeedbackQuestion findById(@Param("id") String id);

    @Select("SELECT id, created_by FROM feedback_questions WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "created_by")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Insert("""
        INSERT INTO feedback_questions (id, title, description, category, is_active, expires_at, created_by, created_at, updated_at)
        VALUES (#{id}, #{title}, #{description}, #{category}, #{isActive}, #{expiresAt}, #{createdById}, #{createdAt}, #{updatedAt})
        """)
    int insert(FeedbackQuestion question);

    @Update("""
        UPDATE feedback_questions SET
            title = #{title},
            description = #{description},
            category = #{category},
            is_active = #{isActive},
            expires_at = #{expiresAt},
            updated_at = #{updatedAt}
        WHERE id = #{id}
        """)
    int update(FeedbackQuestion question);

    /**
     * Removes the question only while nobody has answered it.
     *
     * @return rows affected, 0 when the question is missing or has responses
     */
    @Delete("""
        DELETE FROM feedback_questions q
        WHERE q.id = #{id}
          AND NOT EXISTS (SELECT 1 FROM feedback_responses r WHERE r.feedback_id = q.id)
        """)
    int deleteIfUnanswered(@Param("id") String id);

    @Update("UPDATE feedback_questions SET is_active = FALSE, updated_at = #{now} WHERE id = #{id}")
    int deactivate(@Param("id") String id, @Param("now") OffsetDateTime now);
}
