package org.treesketch.tree.parse;

import org.treesketch.tree.TreeNode;

import java.util.List;
import java.util.Objects;

/**
 * 解析结果：成功时携带森林，失败时携带可读的原因。两者只会出现其一。
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.Rejected {

    static ParseOutcome parsed(List<TreeNode> forest) {
        return new Parsed(forest);
    }

    static ParseOutcome rejected(String reason) {
        return new Rejected(reason);
    }

    default boolean isSuccess() {
        return this instanceof Parsed;
    }

    record Parsed(List<TreeNode> forest) implements ParseOutcome {
        public Parsed {
            forest = List.copyOf(forest);
        }
    }

    record Rejected(String reason) implements ParseOutcome {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
