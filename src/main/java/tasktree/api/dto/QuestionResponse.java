package tasktree.api.dto;

import java.time.Instant;
import java.util.Objects;
import tasktree.domain.QuestionEntry;

/**
 * @param id              question id
 * @param studentId       asking student
 * @param studentName     display name
 * @param classroomId     room
 * @param question        text
 * @param askedAt         when asked
 * @param resolved        resolved flag
 * @param resolvedAt      when resolved
 * @param teacherResponse answer
 */
public record QuestionResponse(
        String id,
        String studentId,
        String studentName,
        String classroomId,
        String question,
        Instant askedAt,
        boolean resolved,
        Instant resolvedAt,
        String teacherResponse
) {
    public static QuestionResponse from(final QuestionEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        return new QuestionResponse(entry.id(), entry.studentId(), entry.studentName(), entry.classroomId(),
                entry.question(), entry.askedAt(), entry.resolved(), entry.resolvedAt(), entry.teacherResponse());
    }
}
