package com.phillippitts.freefleet.service.delegation;

import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.TaskType;

/**
 * Caller overrides for one delegation. Either field may be {@code null} to let the
 * detector decide.
 */
public record DelegationOptions(TaskType forceTaskType, ModelCategory forceCategory) {

    public static final DelegationOptions NONE = new DelegationOptions(null, null);

    public static DelegationOptions forceTaskType(TaskType taskType) {
        return new DelegationOptions(taskType, null);
    }

    public static DelegationOptions forceCategory(ModelCategory category) {
        return new DelegationOptions(null, category);
    }
}
