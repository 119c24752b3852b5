package tasktree;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import tasktree.persistence.store.InMemoryNodeStore;
import tasktree.persistence.store.NodeStore;
import tasktree.service.OrderNormalizer;
import tasktree.service.TreeMutator;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context with the default configuration.
 */
@SpringBootTest
class TaskTreeApplicationTest {

    @Autowired
    private NodeStore store;

    @Autowired
    private TreeMutator treeMutator;

    @Autowired
    private OrderNormalizer orderNormalizer;

    @Test
    void contextLoads() {
        assertThat(store).isInstanceOf(InMemoryNodeStore.class);
        assertThat(store.maxBatchSize()).isEqualTo(500);
        assertThat(treeMutator).isNotNull();
        assertThat(orderNormalizer).isNotNull();
    }
}
