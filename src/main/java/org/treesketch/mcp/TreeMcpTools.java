package org.treesketch.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.treesketch.tree.TreeNode;
import org.treesketch.tree.TreeServerProperties;
import org.treesketch.tree.TreeStateEngine;
import org.treesketch.tree.TreeStateStore;
import org.treesketch.tree.dto.TreeEditResult;
import org.treesketch.tree.dto.TreeNodeLookupResult;
import org.treesketch.tree.dto.TreeParseResult;
import org.treesketch.tree.dto.TreeSnapshotResult;
import org.treesketch.tree.dto.TreeTextResult;
import org.treesketch.tree.format.FormatStyle;
import org.treesketch.tree.format.TreeTextFormatter;
import org.treesketch.tree.parse.DirectoryStructureParser;
import org.treesketch.tree.parse.ParseOutcome;
import org.treesketch.tree.parse.ParseReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 目录树 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>解析目录结构文本（{@code tree_parse}），支持 Markdown 列表与 ASCII 树两种格式。</li>
 *   <li>读取当前目录树（{@code tree_get_state}）与按 id 查找节点（{@code tree_get_node}）。</li>
 *   <li>编辑：展开/折叠、重命名、删除、选中。</li>
 *   <li>把当前目录树渲染回文本（{@code tree_format}）。</li>
 * </ul>
 * <p>
 * 错误处理：
 * <ul>
 *   <li>解析失败不抛异常，通过 {@link TreeParseResult#error()} 返回原因，且不会替换当前目录树。</li>
 *   <li>编辑时 id 不存在视为无操作（{@link TreeEditResult#matched()} 为 false）。</li>
 *   <li>参数本身不合法（空名称、名称含 # 或以 / 结尾、输入过大、未知风格）时抛 {@link IllegalArgumentException}。</li>
 * </ul>
 */
@Component
public class TreeMcpTools {

    private static final Logger log = LoggerFactory.getLogger(TreeMcpTools.class);

    private final TreeServerProperties properties;
    private final DirectoryStructureParser parser;
    private final TreeStateStore store;

    public TreeMcpTools(TreeServerProperties properties, DirectoryStructureParser parser, TreeStateStore store) {
        // properties：输入上限、默认输出风格等配置
        this.properties = properties;
        // parser：清洗 + 格式检测 + 解析
        this.parser = parser;
        // store：当前目录树快照（内存版，按提交顺序串行应用编辑）
        this.store = store;
    }

    @Tool(
            name = "tree_parse",
            description = "解析目录结构文本（Markdown 列表 `- src/` 或 ASCII 树 `├── src/`），成功后替换当前目录树并清空选中状态。"
    )
    /**
     * 解析文本并替换当前目录树。
     * <p>
     * 失败时当前目录树保持不变，不会出现“半棵树”。
     */
    public TreeParseResult parse(
            @ToolParam(description = "目录结构文本；# 开头的行与行尾 # 注释会被忽略，末尾 / 表示目录") String text
    ) {
        if (text != null && text.length() > properties.getMaxInputChars()) {
            throw new IllegalArgumentException("输入过大：" + text.length() + " 字符（上限 app.tree.max-input-chars=" + properties.getMaxInputChars() + "）");
        }

        ParseReport report = parser.parseWithReport(text);
        List<String> warnings = new ArrayList<>();
        if (report.droppedLines() > 0) {
            warnings.add("已忽略 " + report.droppedLines() + " 行注释/装饰行。");
        }

        if (report.outcome() instanceof ParseOutcome.Parsed parsed) {
            TreeStateStore.Snapshot snapshot = store.setTree(parsed.forest());
            log.info("directory tree replaced: format={}, nodes={}, revision={}",
                    report.format(), snapshot.state().nodeCount(), snapshot.revision());
            return new TreeParseResult(
                    true,
                    report.format().name(),
                    null,
                    report.sanitizedLines(),
                    report.droppedLines(),
                    TreeSnapshotResult.of(snapshot),
                    warnings.isEmpty() ? null : warnings
            );
        }

        String reason = ((ParseOutcome.Rejected) report.outcome()).reason();
        log.debug("directory structure rejected: {}", reason);
        return new TreeParseResult(
                false,
                report.format().name(),
                reason,
                report.sanitizedLines(),
                report.droppedLines(),
                null,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "tree_get_state",
            description = "返回当前目录树快照（节点列表、选中节点、版本号）。"
    )
    public TreeSnapshotResult getState() {
        return TreeSnapshotResult.of(store.snapshot());
    }

    @Tool(
            name = "tree_get_node",
            description = "按 id 查找节点（含其子树）。"
    )
    public TreeNodeLookupResult getNode(
            @ToolParam(description = "节点 id") String id
    ) {
        requireId(id);
        TreeNode node = store.getNodeById(id);
        return new TreeNodeLookupResult(id, node != null, node);
    }

    @Tool(
            name = "tree_toggle_expand",
            description = "切换目录的展开/折叠状态；id 属于文件或不存在时不做任何修改。"
    )
    public TreeEditResult toggleExpand(
            @ToolParam(description = "目录节点 id") String id
    ) {
        requireId(id);
        TreeStateStore.Snapshot snapshot = store.toggleExpand(id);
        TreeNode target = previousNode(snapshot, id);
        return new TreeEditResult("toggle_expand", id, target != null && target.isFolder(), TreeSnapshotResult.of(snapshot));
    }

    @Tool(
            name = "tree_rename",
            description = "重命名文件或目录（名称不能为空，不能包含 #，不能以 / 结尾；首尾空白会被去掉）。"
    )
    public TreeEditResult rename(
            @ToolParam(description = "节点 id") String id,
            @ToolParam(description = "新名称") String name
    ) {
        requireId(id);
        String trimmed = requireName(name);
        TreeStateStore.Snapshot snapshot = store.renameNode(id, trimmed);
        boolean matched = previousNode(snapshot, id) != null;
        return new TreeEditResult("rename", id, matched, TreeSnapshotResult.of(snapshot));
    }

    @Tool(
            name = "tree_delete",
            description = "删除节点及其整棵子树；若删除的是当前选中节点，则同时清空选中状态。"
    )
    public TreeEditResult delete(
            @ToolParam(description = "节点 id") String id
    ) {
        requireId(id);
        TreeStateStore.Snapshot snapshot = store.deleteNode(id);
        boolean matched = previousNode(snapshot, id) != null;
        return new TreeEditResult("delete", id, matched, TreeSnapshotResult.of(snapshot));
    }

    @Tool(
            name = "tree_select",
            description = "选中节点；id 为空时清空选中状态。"
    )
    public TreeEditResult select(
            @ToolParam(required = false, description = "节点 id（为空表示取消选中）") String id
    ) {
        String selected = (id == null || id.isBlank()) ? null : id;
        TreeStateStore.Snapshot snapshot = store.selectNode(selected);
        boolean matched = selected == null || previousNode(snapshot, selected) != null;
        return new TreeEditResult("select", selected, matched, TreeSnapshotResult.of(snapshot));
    }

    @Tool(
            name = "tree_format",
            description = "把当前目录树渲染为文本（markdown 或 ascii），输出可再次被 tree_parse 解析。"
    )
    public TreeTextResult format(
            @ToolParam(required = false, description = "输出风格：markdown / ascii（默认 app.tree.format-default-style）") String style,
            @ToolParam(required = false, description = "是否只输出展开的节点（默认 false）") Boolean visibleOnly
    ) {
        FormatStyle resolved = FormatStyle.parse(style, properties.getFormatDefaultStyle());
        boolean onlyVisible = Boolean.TRUE.equals(visibleOnly);
        String indent = " ".repeat(properties.getFormatIndentWidth());

        List<TreeNode> forest = store.state().forest();
        String text = onlyVisible
                ? TreeTextFormatter.formatVisible(forest, resolved, indent)
                : TreeTextFormatter.format(forest, resolved, indent);
        int lineCount = text.isEmpty() ? 0 : text.split("\n", -1).length;
        return new TreeTextResult(resolved.name().toLowerCase(Locale.ROOT), onlyVisible, lineCount, text);
    }

    /**
     * 编辑所基于的那份状态中的节点（与 dispatch 使用的快照一致，不受并发调用影响）。
     */
    private static TreeNode previousNode(TreeStateStore.Snapshot snapshot, String id) {
        return TreeStateEngine.findById(snapshot.previous().forest(), id);
    }

    /**
     * 名称需能被 tree_format 输出后再次解析回原样：# 会被当作行尾注释，末尾 / 会把节点识别成目录。
     */
    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("名称不能为空");
        }
        String trimmed = name.trim();
        if (trimmed.indexOf('#') >= 0) {
            throw new IllegalArgumentException("名称不能包含 #：" + trimmed);
        }
        if (trimmed.endsWith("/")) {
            throw new IllegalArgumentException("名称不能以 / 结尾：" + trimmed);
        }
        return trimmed;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("节点 id 不能为空");
        }
    }
}
