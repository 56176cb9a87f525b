package xyz.firestige.pipeline.core.producer;

import xyz.firestige.pipeline.api.ActionProducer;
import xyz.firestige.pipeline.api.ProduceOptions;
import xyz.firestige.pipeline.api.ProduceResult;
import xyz.firestige.pipeline.api.blueprint.ManualApprovalStep;
import xyz.firestige.pipeline.api.model.ActionCategory;
import xyz.firestige.pipeline.api.model.StageAction;

import java.util.Objects;

/**
 * 人工审批动作，不需要计算身份
 */
public class ManualApprovalProducer implements ActionProducer {

    private final ManualApprovalStep step;

    public ManualApprovalProducer(ManualApprovalStep step) {
        this.step = Objects.requireNonNull(step, "step cannot be null");
    }

    @Override
    public ProduceResult produce(ProduceOptions options) {
        options.stage().addAction(StageAction.builder(options.actionName(), ActionCategory.APPROVAL)
            .runOrder(options.runOrder())
            .configuration("CustomData", step.getComment())
            .build());
        return ProduceResult.of(1);
    }
}
