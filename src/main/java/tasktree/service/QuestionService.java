package tasktree.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.domain.Node;
import tasktree.domain.QuestionEntry;
import tasktree.domain.Validation;
import tasktree.persistence.store.NodeStore;

/**
 * Help requests raised by students against one node occurrence.
 *
 * <p>Each operation is a single-document read-modify-write, so concurrent questions on
 * the same node never overwrite each other.
 */
@Service
public class QuestionService {

    private static final Logger LOG = LoggerFactory.getLogger(QuestionService.class);

    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 9;

    private final NodeStore store;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public QuestionService(final NodeStore store, final Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Appends an unresolved question to the node's history.
     *
     * @param nodeId      node asked about
     * @param studentId   asking student
     * @param studentName display name
     * @param classroomId room the question comes from
     * @param question    question text
     * @return the new question id
     */
    public String ask(
            final String nodeId,
            final String studentId,
            final String studentName,
            final String classroomId,
            final String question) {
        Validation.validateNotBlank(nodeId, "nodeId");
        Validation.validateNotBlank(studentId, "studentId");
        Validation.validateNotBlank(question, "question");
        final Instant now = clock.instant();
        final QuestionEntry entry = new QuestionEntry(
                newQuestionId(now), studentId, studentName, classroomId, question.trim(), now, false, null, null);
        store.transform(nodeId, node -> {
            final List<QuestionEntry> history = new ArrayList<>(node.getQuestionHistory());
            history.add(entry);
            node.setQuestionHistory(history);
            node.touch(now);
            return node;
        });
        LOG.info("Question {} asked on {} from {}", entry.id(), nodeId, classroomId);
        return entry.id();
    }

    /**
     * Marks a question as resolved.
     *
     * @param nodeId          node holding the question
     * @param questionId      question to resolve
     * @param teacherResponse optional answer
     * @return the resolved entry
     * @throws ResourceNotFoundException if the node or the question does not exist
     */
    public QuestionEntry resolve(final String nodeId, final String questionId, final String teacherResponse) {
        Validation.validateNotBlank(nodeId, "nodeId");
        Validation.validateNotBlank(questionId, "questionId");
        final Instant now = clock.instant();
        final Node written = store.transform(nodeId, node -> {
            final List<QuestionEntry> history = new ArrayList<>(node.getQuestionHistory());
            final int index = indexOf(history, questionId);
            if (index < 0) {
                throw new ResourceNotFoundException("Question not found: " + questionId);
            }
            history.set(index, history.get(index).resolve(teacherResponse, now));
            node.setQuestionHistory(history);
            node.touch(now);
            return node;
        });
        return written.getQuestionHistory().get(indexOf(written.getQuestionHistory(), questionId));
    }

    /**
     * @param nodeId      node holding the questions
     * @param classroomId only questions from this room (null for all)
     * @return questions in the order they were asked
     */
    public List<QuestionEntry> list(final String nodeId, final String classroomId) {
        Validation.validateNotBlank(nodeId, "nodeId");
        final Node node = store.get(nodeId).orElseThrow(() -> ResourceNotFoundException.node(nodeId));
        if (classroomId == null || classroomId.isBlank()) {
            return node.getQuestionHistory();
        }
        return node.getQuestionHistory().stream()
                .filter(entry -> classroomId.equals(entry.classroomId()))
                .toList();
    }

    private String newQuestionId(final Instant now) {
        final StringBuilder id = new StringBuilder("q_").append(now.toEpochMilli()).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return id.toString();
    }

    private static int indexOf(final List<QuestionEntry> history, final String questionId) {
        for (int i = 0; i < history.size(); i++) {
            if (history.get(i).id().equals(questionId)) {
                return i;
            }
        }
        return -1;
    }
}
