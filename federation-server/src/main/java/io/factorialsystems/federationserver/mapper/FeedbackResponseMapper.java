package io.factorialsystems.federationserver.mapper;

import io.factorialsystems.federationserver.model.FeedbackResponse;
import io.factorialsystems.federationserver.model.FeedbackStatus;
import io.factorialsystems.federationserver.model.ResourceOwnership;
import org.apache.ibatis.annotations.*;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface FeedbackResponseMapper {

    @Select("""
        SELECT r.*,
               q.title AS feedback_title, q.description AS feedback_description, q.category AS feedback_category,
               u.username AS created_by_username, u.email AS created_by_email
        FROM feedback_responses r
        LEFT JOIN feedback_questions q ON q.id = r.feedback_id
        LEFT JOIN users u ON u.id = r.created_by
        ORDER BY r.created_at DESC
        """)
    @Results(id = "feedbackResponseResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "feedbackId", column = "feedback_id"),
        @Result(property = "response", column = "response"),
        @Result(property = "rating", column = "rating"),
        @Result(property = "status", column = "status"),
        @Result(property = "adminComment", column = "admin_comment"),
        @Result(property = "createdById", column = "created_by"),
        @Result(property = "feedback.id", column = "feedback_id"),
        @Result(property = "feedback.title", column = "feedback_title"),
        @Result(property = "feedback.description", column = "feedback_description"),
        @Result(property = "feedback.category", column = "feedback_category"),
        @Result(property = "createdBy.id", column = "created_by"),
        @Result(property = "createdBy.username", column = "created_by_username"),
        @Result(property = "createdBy.email", column = "created_by_email"),
        @Result(property = "createdAt", column = "created_at"),
        @Result(property = "updatedAt", column = "updated_at")
    })
    List<FeedbackResponse> findAll();

    @Select("""
        SELECT r.*,
               q.title AS feedback_title, q.description AS feedback_description, q.category AS feedback_category
        FROM feedback_responses r
        LEFT JOIN feedback_questions q ON q.id = r.feedback_id
        WHERE r.created_by = #{userId}
        ORDER BY r.created_at DESC
        """)
    @ResultMap("feedbackResponseResult")
    List<FeedbackResponse> findByUser(@Param("userId") String userId);

    @Select("""
        SELECT r.*, u.username AS created_by_username, u.email AS created_by_email
        FROM feedback_responses r
        LEFT JOIN users u ON u.id = r.created_by
        WHERE r.feedback_id = #{questionId}
        ORDER BY r.created_at DESC
        """)
    @ResultMap("feedbackResponseResult")
    List<FeedbackResponse> findByQuestion(@Param("questionId") String questionId);

    @Select("""
        SELECT r.*,
               q.title AS feedback_title, q.description AS feedback_description, q.category AS feedback_category,
               u.username AS created_by_username, u.email AS created_by_email
        FROM feedback_responses r
        LEFT JOIN feedback_questions q ON q.id = r.feedback_id
        LEFT JOIN users u ON u.id = r.created_by
        WHERE r.id = #{id}
        """)
    @ResultMap("feedbackResponseResult")
    FeedbackResponse findById(@Param("id") String id);

    @Select("SELECT id, created_by FROM feedback_responses WHERE id = #{id}")
    @Results({
        @Result(property = "id", column = "id"),
        @Result(property = "ownerId", column = "created_by")
    })
    ResourceOwnership findOwnership(@Param("id") String id);

    @Select("SELECT EXISTS (SELECT 1 FROM feedback_responses WHERE feedback_id = #{questionId} AND created_by = #{userId})")
    boolean existsForUser(@Param("questionId") String questionId, @Param("userId") String userId);

    /**
     * Inserts the response only when the question is open and the user has not answered it yet.
     *
     * @return rows affected, 0 or 1
     */
    @Insert("""
        INSERT INTO feedback_responses (id, feedback_id, response, rating, status, admin_comment, created_by, created_at, updated_at)
        SELECT #{id}, q.id, #{response}, CAST(#{rating, jdbcType=INTEGER} AS INTEGER), #{status},
               NULL, #{createdById}, #{createdAt}, #{updatedAt}
        FROM feedback_questions q
        WHERE q.id = #{feedbackId}
          AND q.is_active = TRUE
          AND (q.expires_at IS NULL OR q.expires_at > #{createdAt})
        ON CONFLICT (feedback_id, created_by) DO NOTHING
        """)
    int insertIfOpen(FeedbackResponse response);

    @Update("""
        UPDATE feedback_responses SET
            admin_comment = #{adminComment},
            status = #{status},
            updated_at = #{updatedAt}
        WHERE id = #{id}
        """)
    int updateReview(@Param("id") String id,
                     @Param("adminComment") String adminComment,
                     @Param("status") FeedbackStatus status,
                     @Param("updatedAt") OffsetDateTime updatedAt);

    @Update("UPDATE feedback_responses SET status = #{status}, updated_at = #{updatedAt} WHERE id = #{id}")
    int updateStatus(@Param("id") String id,
                     @Param("status") FeedbackStatus status,
                     @Param("updatedAt") OffsetDateTime updatedAt);

    @Delete("DELETE FROM feedback_responses WHERE id = #{id}")
    int delete(@Param("id") String id);
}
