package xyz.firestige.pipeline.api.blueprint;

/**
 * 人工审批步骤
 */
public class ManualApprovalStep extends Step {

    private final String comment;

    public ManualApprovalStep(String id) {
        this(id, null);
    }

    public ManualApprovalStep(String id, String comment) {
        super(id);
        this.comment = comment;
    }

    public String getComment() {
        return comment;
    }
}
