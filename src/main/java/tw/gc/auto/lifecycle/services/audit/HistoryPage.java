package tw.gc.auto.lifecycle.services.audit;

import tw.gc.auto.lifecycle.entities.AuditEntry;

import java.util.List;

/**
 * One page of a family's audit history, newest first.
 *
 * @param nextCursor pass back to fetch the next (older) page; null when this page is the last
 */
public record HistoryPage(String familyId, List<AuditEntry> entries, Long nextCursor) {

    public boolean hasMore() {
        return nextCursor != null;
    }
}
