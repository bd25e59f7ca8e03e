package org.dxworks.codelint.rules.overload;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Adjacency bookkeeping for the members of one scope.
 */
public class ScanState {
    private MemberIdentity lastIdentity;
    private final Set<MemberIdentity> seenIdentities = new LinkedHashSet<>();

    /**
     * Feeds the next member of the scope, {@code null} for an opaque one.
     *
     * @return true if the member repeats an earlier, non-adjacent member
     */
    public boolean observe(MemberIdentity identity) {
        if (identity == null) {
            lastIdentity = null;
            return false;
        }
        boolean misplaced = false;
        if (seenIdentities.contains(identity)) {
            misplaced = !identity.equals(lastIdentity);
        } else {
            seenIdentities.add(identity);
        }
        lastIdentity = identity;
        return misplaced;
    }

    public MemberIdentity getLastIdentity() {
        return lastIdentity;
    }

    public Set<MemberIdentity> getSeenIdentities() {
        return Collections.unmodifiableSet(seenIdentities);
    }
}
