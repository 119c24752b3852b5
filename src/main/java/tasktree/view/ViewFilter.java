package tasktree.view;

import java.time.LocalDate;
import java.util.Locale;
import tasktree.domain.Node;
import tasktree.domain.NodeKind;

/**
 * Selection applied to the flat node set before the forest is rebuilt.
 *
 * <p>Every criterion is optional. A node without a window matches any date.
 *
 * @param room     room that must be in the node's visibility (nullable)
 * @param date     day that must fall inside the node's window, bounds included (nullable)
 * @param text     case-insensitive text searched in title and description (nullable)
 * @param kind     required kind (nullable)
 * @param audience audience; students never see drafts
 */
public record ViewFilter(String room, LocalDate date, String text, NodeKind kind, Audience audience) {

    public ViewFilter {
        room = room == null || room.isBlank() ? null : room.trim();
        text = text == null || text.isBlank() ? null : text.trim().toLowerCase(Locale.ROOT);
        audience = audience == null ? Audience.TEACHER : audience;
    }

    public static ViewFilter everything() {
        return new ViewFilter(null, null, null, null, Audience.TEACHER);
    }

    public static ViewFilter forRoom(final String room, final Audience audience) {
        return new ViewFilter(room, null, null, null, audience);
    }

    public ViewFilter onDate(final LocalDate day) {
        return new ViewFilter(room, day, text, kind, audience);
    }

    public ViewFilter matching(final String query) {
        return new ViewFilter(room, date, query, kind, audience);
    }

    public ViewFilter ofKind(final NodeKind value) {
        return new ViewFilter(room, date, text, value, audience);
    }

    /**
     * @param node candidate node
     * @return true if the node is part of this view
     */
    public boolean test(final Node node) {
        if (audience == Audience.STUDENT && !node.getStatus().isPublished()) {
            return false;
        }
        if (room != null && !node.getVisibility().contains(room)) {
            return false;
        }
        if (date != null && node.getWindow() != null && !node.getWindow().contains(date)) {
            return false;
        }
        if (kind != null && node.getKind() != kind) {
            return false;
        }
        if (text != null) {
            return node.getTitle().toLowerCase(Locale.ROOT).contains(text)
                    || node.getDescription().toLowerCase(Locale.ROOT).contains(text);
        }
        return true;
    }
}
