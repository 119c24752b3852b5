package tasktree.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Help request raised from the student view.
 *
 * @param studentId   asking student
 * @param studentName display name
 * @param classroomId room the question comes from
 * @param question    question text
 */
public record QuestionRequest(
        @NotBlank(message = "studentId must not be null or blank")
        String studentId,
        String studentName,
        String classroomId,
        @NotBlank(message = "question must not be null or blank")
        @Size(max = 2000, message = "question must be at most {max} characters")
        String question
) {
}
