package xyz.firestige.pipeline.api.model;

/**
 * 流水线动作类别
 */
public enum ActionCategory {
    SOURCE,
    BUILD,
    APPROVAL,
    CREATE_CHANGE_SET,
    EXECUTE_CHANGE_SET,
    CUSTOM
}
