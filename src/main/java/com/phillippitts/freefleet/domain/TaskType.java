package com.phillippitts.freefleet.domain;

/**
 * Kinds of task a prompt can be classified as, each routed to a fixed category.
 */
public enum TaskType {
    CODE_GENERATION(ModelCategory.CODING),
    CODE_REVIEW(ModelCategory.CODING),
    DEBUGGING(ModelCategory.CODING),
    REASONING(ModelCategory.REASONING),
    MATH(ModelCategory.REASONING),
    WRITING(ModelCategory.WRITING),
    SUMMARIZATION(ModelCategory.SPEED),
    TRANSLATION(ModelCategory.WRITING),
    MULTIMODAL(ModelCategory.MULTIMODAL),
    GENERAL(ModelCategory.WRITING);

    private final ModelCategory category;

    TaskType(ModelCategory category) {
        this.category = category;
    }

    public ModelCategory category() {
        return category;
    }
}
