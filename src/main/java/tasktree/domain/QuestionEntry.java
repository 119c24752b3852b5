package tasktree.domain;

import java.time.Instant;

/**
 * One help request raised by a student against a specific node occurrence.
 *
 * <p>Question history belongs to the lived instance of a task and is never carried
 * over when the node is duplicated.
 *
 * @param id              question id
 * @param studentId       asking student
 * @param studentName     display name at the time of asking
 * @param classroomId     room the question was asked from
 * @param question        question text
 * @param askedAt         when the question was asked
 * @param resolved        whether a teacher has resolved it
 * @param resolvedAt      when it was resolved (nullable)
 * @param teacherResponse optional response text (nullable)
 */
public record QuestionEntry(
        String id,
        String studentId,
        String studentName,
        String classroomId,
        String question,
        Instant askedAt,
        boolean resolved,
        Instant resolvedAt,
        String teacherResponse) {

    public QuestionEntry {
        Validation.validateNotBlank(id, "question id");
        Validation.validateNotBlank(question, "question");
    }

    /**
     * Returns a resolved copy of this entry.
     *
     * @param response   teacher response (nullable, stored as empty string)
     * @param resolvedOn resolution time
     * @return the resolved entry
     */
    public QuestionEntry resolve(final String response, final Instant resolvedOn) {
        return new QuestionEntry(
                id,
                studentId,
                studentName,
                classroomId,
                question,
                askedAt,
                true,
                resolvedOn,
                response == null ? "" : response);
    }
}
