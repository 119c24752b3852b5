package tasktree.api.dto;

/**
 * @param newParentId new parent, or null to move the node to the root group
 */
public record MoveRequest(String newParentId) {
}
