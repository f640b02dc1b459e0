package xyz.vvrf.cfg.monitor;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 图操作在降级路径上产生的诊断信息。
 */
@Data
@Builder
public class Diagnostic {
    private Kind kind;

    private String graphId;
    private String nodeName;
    // 按内部 ID 排列的后继名称及其边 label，两个列表一一对应
    private List<String> successorNames;
    private List<String> edgeLabels;
    /** 降级后实际返回的后继名称。 */
    private String chosenSuccessor;

    private String message;

    public enum Kind {
        AMBIGUOUS_TRUE_BRANCH, AMBIGUOUS_FALSE_BRANCH
    }
}
