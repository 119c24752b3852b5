package tasktree.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import tasktree.api.dto.QuestionRequest;
import tasktree.api.dto.QuestionResponse;
import tasktree.api.dto.ResolveQuestionRequest;
import tasktree.service.QuestionService;

/**
 * Help requests attached to a node.
 *
 * <ul>
 *   <li>POST /api/nodes/{id}/questions - ask (201 Created, returns the question id)</li>
 *   <li>GET /api/nodes/{id}/questions - list, optionally for one classroom</li>
 *   <li>POST /api/nodes/{id}/questions/{questionId}/resolve - resolve</li>
 * </ul>
 */
@RestController
@RequestMapping(value = "/api/nodes/{id}/questions", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Questions", description = "Student help requests")
public class QuestionController {

    private final QuestionService questionService;

    public QuestionController(final QuestionService questionService) {
        this.questionService = questionService;
    }

    @Operation(summary = "Ask a question about a node")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public String ask(@PathVariable final String id, @Valid @RequestBody final QuestionRequest request) {
        return questionService.ask(id, request.studentId(), request.studentName(), request.classroomId(),
                request.question());
    }

    @Operation(summary = "List questions asked about a node")
    @GetMapping
    public List<QuestionResponse> list(
            @PathVariable final String id,
            @RequestParam(required = false) final String classroomId) {
        return questionService.list(id, classroomId).stream().map(QuestionResponse::from).toList();
    }

    @Operation(summary = "Resolve a question")
    @PostMapping("/{questionId}/resolve")
    public QuestionResponse resolve(
            @PathVariable final String id,
            @PathVariable final String questionId,
            @RequestBody(required = false) final ResolveQuestionRequest request) {
        return QuestionResponse.from(questionService.resolve(id, questionId,
                request == null ? null : request.teacherResponse()));
    }
}
