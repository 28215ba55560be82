package tw.gc.auto.lifecycle.services.audit;

public record ChainVerification(String familyId, int entriesChecked, boolean intact, Long firstBrokenEntryId) {

    static ChainVerification intact(String familyId, int entriesChecked) {
        return new ChainVerification(familyId, entriesChecked, true, null);
    }

    static ChainVerification broken(String familyId, int entriesChecked, Long entryId) {
        return new ChainVerification(familyId, entriesChecked, false, entryId);
    }
}
