package tasktree.api.dto;

/**
 * @param teacherResponse optional answer shown to the student
 */
public record ResolveQuestionRequest(String teacherResponse) {
}
