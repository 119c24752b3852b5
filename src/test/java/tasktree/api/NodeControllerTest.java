package tasktree.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tasktree.persistence.store.NodeStore;
import tasktree.service.DescendantPolicy;

/**
 * Integration tests for {@link NodeController}, {@link QuestionController} and
 * {@link MaintenanceController} over the full application context.
 *
 * <p>Each test starts from an empty in-memory store.
 */
@SpringBootTest
@AutoConfigureMockMvc
class NodeControllerTest {

    private static final String OWNER = "teacher-1";
    private static final String ROOM = "room-a";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private NodeStore store;

    @BeforeEach
    void resetStore() {
        store.deleteAll();
    }

    private String createNode(final String title, final String parentId) throws Exception {
        final String parent = parentId == null ? "null" : "\"" + parentId + "\"";
        final String body = mockMvc.perform(post("/api/nodes")
                        .header(NodeController.OWNER_HEADER, OWNER)
                        .header(NodeController.ROOM_HEADER, ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"" + title + "\", \"parentId\": " + parent + "}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    @Nested
    @DisplayName("Create and read")
    class CreateAndRead {

        @Test
        @DisplayName("POST creates a root in the active room")
        void createRoot() throws Exception {
            mockMvc.perform(post("/api/nodes")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .header(NodeController.ROOM_HEADER, ROOM)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"kind": "PROJECT", "title": "Project A",
                                     "startDate": "2025-09-08", "endDate": "2025-09-12"}
                                    """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.title").value("Project A"))
                    .andExpect(jsonPath("$.kind").value("PROJECT"))
                    .andExpect(jsonPath("$.status").value("TODO"))
                    .andExpect(jsonPath("$.order").value(1))
                    .andExpect(jsonPath("$.visibility[0]").value(ROOM))
                    .andExpect(jsonPath("$.startDate").value("2025-09-08"))
                    .andExpect(jsonPath("$.path", hasSize(0)));
        }

        @Test
        @DisplayName("Child carries its ancestor chain")
        void createChild() throws Exception {
            final String project = createNode("Project A", null);
            final String child = createNode("Assignment B", project);

            mockMvc.perform(get("/api/nodes/{id}", child))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.parentId").value(project))
                    .andExpect(jsonPath("$.rootId").value(project))
                    .andExpect(jsonPath("$.path[0]").value(project))
                    .andExpect(jsonPath("$.pathTitles[0]").value("Project A"));
            mockMvc.perform(get("/api/nodes/{id}", project))
                    .andExpect(jsonPath("$.childIds[0]").value(child));
        }

        @Test
        @DisplayName("Autosave keeps an untitled draft")
        void autosaveDraft() throws Exception {
            mockMvc.perform(post("/api/nodes").param("autosave", "true")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("DRAFT"));
        }

        @Test
        @DisplayName("Explicit save without a title is rejected")
        void missingTitle() throws Exception {
            mockMvc.perform(post("/api/nodes")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .header(NodeController.ROOM_HEADER, ROOM)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": \"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Please enter a title."));
        }

        @Test
        @DisplayName("Missing owner header is a 400")
        void missingOwner() throws Exception {
            mockMvc.perform(post("/api/nodes")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": \"Project\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("X-Owner-Id header is required"));
        }

        @Test
        @DisplayName("Numeric title is not coerced to text")
        void numericTitleRejected() throws Exception {
            mockMvc.perform(post("/api/nodes")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .header(NodeController.ROOM_HEADER, ROOM)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": 42}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Unknown parent is a 400")
        void danglingParent() throws Exception {
            mockMvc.perform(post("/api/nodes")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .header(NodeController.ROOM_HEADER, ROOM)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"title\": \"Lost\", \"parentId\": \"ghost\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Parent not found: ghost"));
        }

        @Test
        @DisplayName("Unknown node is a 404")
        void notFound() throws Exception {
            mockMvc.perform(get("/api/nodes/{id}", "nope"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.message").value("Node not found: nope"));
        }
    }

    @Nested
    @DisplayName("Structural changes")
    class StructuralChanges {

        @Test
        @DisplayName("PATCH with cascade pushes status to children")
        void updateWithCascade() throws Exception {
            final String project = createNode("Project A", null);
            final String child = createNode("Assignment B", project);

            mockMvc.perform(patch("/api/nodes/{id}", project).param("cascade", "true")
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\": \"DONE\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.node.status").value("DONE"))
                    .andExpect(jsonPath("$.cascadedCount").value(1))
                    .andExpect(jsonPath("$.warning").doesNotExist());
            mockMvc.perform(get("/api/nodes/{id}", child))
                    .andExpect(jsonPath("$.status").value("DONE"));
        }

        @Test
        @DisplayName("Move to root detaches the subtree")
        void moveToRoot() throws Exception {
            final String project = createNode("Project A", null);
            final String child = createNode("Assignment B", project);
            final String grandchild = createNode("Task C", child);

            mockMvc.perform(post("/api/nodes/{id}/move", child)
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"newParentId\": null}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.previousParentId").value(project))
                    .andExpect(jsonPath("$.rebasedDescendants[0]").value(grandchild));
            mockMvc.perform(get("/api/nodes/{id}", grandchild))
                    .andExpect(jsonPath("$.rootId").value(child))
                    .andExpect(jsonPath("$.path", hasSize(1)));
        }

        @Test
        @DisplayName("Reorder reports whether the node moved")
        void reorder() throws Exception {
            final String project = createNode("Project A", null);
            final String first = createNode("First", project);
            createNode("Second", project);

            mockMvc.perform(post("/api/nodes/{id}/reorder", first)
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"direction\": \"UP\"}"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("false"));
            mockMvc.perform(post("/api/nodes/{id}/reorder", first)
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"direction\": \"DOWN\"}"))
                    .andExpect(content().string("true"));
        }

        @Test
        @DisplayName("Duplicate returns the id map")
        void duplicate() throws Exception {
            final String project = createNode("Project A", null);
            final String child = createNode("Assignment B", project);

            mockMvc.perform(post("/api/nodes/{id}/duplicate", project)
                            .header(NodeController.OWNER_HEADER, OWNER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"includeDescendants\": true, \"newTitle\": \"Project A (copy)\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.newRootId").isNotEmpty())
                    .andExpect(jsonPath("$.idMap['" + child + "']").isNotEmpty());
        }

        @Test
        @DisplayName("Delete with children needs a decision")
        void deleteNeedsPolicy() throws Exception {
            final String project = createNode("Project A", null);
            createNode("Assignment B", project);

            mockMvc.perform(delete("/api/nodes/{id}", project).header(NodeController.OWNER_HEADER, OWNER))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.message", startsWith("This item has 1 child.")));
            mockMvc.perform(delete("/api/nodes/{id}", project).param("descendants", "sideways")
                            .header(NodeController.OWNER_HEADER, OWNER))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(delete("/api/nodes/{id}", project).param("descendants", "delete")
                            .header(NodeController.OWNER_HEADER, OWNER))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.deletedIds", hasSize(2)));
        }
    }

    @Nested
    @DisplayName("Views, questions and maintenance")
    class ViewsAndQuestions {

        @Test
        @DisplayName("Forest is numbered depth-first")
        void forest() throws Exception {
            final String project = createNode("Project A", null);
            createNode("Assignment B", project);

            mockMvc.perform(get("/api/nodes/forest").param("room", ROOM))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(2)))
                    .andExpect(jsonPath("$[0].number").value("1"))
                    .andExpect(jsonPath("$[1].number").value("1.1"))
                    .andExpect(jsonPath("$[1].breadcrumb").value("Project A"))
                    .andExpect(jsonPath("$[0].total").value(1));
            mockMvc.perform(get("/api/nodes/forest").param("room", "room-z"))
                    .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("Questions can be asked, listed and resolved")
        void questions() throws Exception {
            final String task = createNode("Lab report", null);

            final String questionId = mockMvc.perform(post("/api/nodes/{id}/questions", task)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"studentId": "s-1", "studentName": "Ana",
                                     "classroomId": "room-a", "question": "Which template?"}
                                    """))
                    .andExpect(status().isCreated())
                    .andReturn().getResponse().getContentAsString();
            assertThat(questionId).startsWith("q_");

            mockMvc.perform(get("/api/nodes/{id}", task))
                    .andExpect(jsonPath("$.openQuestions").value(1));
            mockMvc.perform(post("/api/nodes/{id}/questions/{qid}/resolve", task, questionId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"teacherResponse\": \"The blue one.\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.resolved").value(true));
            mockMvc.perform(get("/api/nodes/{id}/questions", task).param("classroomId", "room-a"))
                    .andExpect(jsonPath("$[0].teacherResponse").value("The blue one."));
        }

        @Test
        @DisplayName("Blank question fails bean validation")
        void blankQuestion() throws Exception {
            final String task = createNode("Lab report", null);

            mockMvc.perform(post("/api/nodes/{id}/questions", task)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"studentId\": \"s-1\", \"question\": \" \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("question must not be null or blank"));
        }

        @Test
        @DisplayName("Normalization run reports its counts")
        void normalizeOrder() throws Exception {
            createNode("Project A", null);

            mockMvc.perform(post("/api/maintenance/normalize-order"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.groupsScanned").value(1))
                    .andExpect(jsonPath("$.updatesApplied").value(0));
        }
    }

    @Nested
    @DisplayName("Descendants policy parameter")
    class PolicyParameter {

        @ParameterizedTest
        @CsvSource({"delete, DELETE", "DELETE, DELETE", "orphan, ORPHAN", "keep, ORPHAN", "' ', REJECT"})
        void mapsKnownValues(final String value, final DescendantPolicy expected) {
            assertThat(NodeController.policyOf(value)).isEqualTo(expected);
        }

        @Test
        void absentMeansReject() {
            assertThat(NodeController.policyOf(null)).isEqualTo(DescendantPolicy.REJECT);
        }

        @Test
        void unknownValueRejected() {
            assertThatThrownBy(() -> NodeController.policyOf("cascade"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("descendants must be 'delete', 'orphan' or 'keep'");
        }
    }
}
