package org.treesketch.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 目录树状态存储（内存版，单进程）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>解析成功后调用 {@link #setTree(List)} 整体替换森林。</li>
 *   <li>之后的展开/折叠、重命名、删除、选中逐个 {@link #dispatch(TreeAction)}，每次都基于上一份快照计算新快照。</li>
 * </ol>
 * <p>
 * 说明：
 * <ul>
 *   <li>dispatch 串行执行，保证动作严格按提交顺序生效。</li>
 *   <li>读者拿到的 {@link Snapshot} 不可变；编辑进行中读取到的旧快照也始终是完整的一棵树。</li>
 *   <li>不做持久化：进程重启后状态丢失。</li>
 * </ul>
 */
public class TreeStateStore {

    private static final Logger log = LoggerFactory.getLogger(TreeStateStore.class);

    private final Object lock = new Object();
    private volatile Snapshot current = new Snapshot(TreeState.EMPTY, 0L, TreeState.EMPTY);

    public Snapshot snapshot() {
        return current;
    }

    public TreeState state() {
        return current.state();
    }

    public Snapshot dispatch(TreeAction action) {
        synchronized (lock) {
            Snapshot previous = current;
            TreeState next = TreeStateEngine.apply(previous.state(), action);
            Snapshot updated = new Snapshot(next, previous.revision() + 1, previous.state());
            current = updated;
            if (log.isDebugEnabled()) {
                log.debug("tree action applied: {} (revision={}, nodes={})",
                        action.getClass().getSimpleName(), updated.revision(), next.nodeCount());
            }
            return updated;
        }
    }

    public Snapshot setTree(List<TreeNode> forest) {
        return dispatch(new TreeAction.ReplaceForest(forest));
    }

    public Snapshot toggleExpand(String id) {
        return dispatch(new TreeAction.ToggleExpand(id));
    }

    public Snapshot renameNode(String id, String name) {
        return dispatch(new TreeAction.Rename(id, name));
    }

    public Snapshot deleteNode(String id) {
        return dispatch(new TreeAction.Delete(id));
    }

    public Snapshot selectNode(String id) {
        return dispatch(new TreeAction.Select(id));
    }

    public TreeNode getNodeById(String id) {
        return TreeStateEngine.findById(current.state().forest(), id);
    }

    /**
     * @param state    状态快照
     * @param revision 版本号（每次 dispatch 自增 1，初始为 0）
     * @param previous 本次 dispatch 所基于的状态（初始快照为空状态）
     */
    public record Snapshot(TreeState state, long revision, TreeState previous) {
    }
}
