package com.conveyal.viewshed.error;

import com.conveyal.viewshed.los.NoDataPolicy;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A non-fatal report attached to a finished visibility grid: some sight lines crossed no-data terrain. How those
 * targets were resolved depends on the policy in effect, which is recorded alongside the number of affected targets.
 * This is reported as metadata rather than thrown, since no-data never aborts a computation.
 */
public class IndeterminateSampleWarning {

    public final NoDataPolicy policy;

    /** Number of target cells whose sight line passed over at least one no-data sample. */
    public final int affectedTargets;

    public final String message;

    public IndeterminateSampleWarning (NoDataPolicy policy, int affectedTargets) {
        checkArgument(affectedTargets > 0, "A warning must concern at least one target.");
        this.policy = policy;
        this.affectedTargets = affectedTargets;
        this.message = String.format("%d sight lines crossed no-data terrain, resolved as %s.",
                affectedTargets, policy.resolution());
    }

    @Override
    public String toString () {
        return message;
    }

}
