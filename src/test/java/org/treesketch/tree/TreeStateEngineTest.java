package org.treesketch.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.treesketch.tree.parse.DirectoryStructureParser;
import org.treesketch.tree.parse.ParseOutcome;
import org.treesketch.tree.parse.SequentialNodeIdGenerator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreeStateEngineTest {

    // n-1 project/, n-2 src/, n-3 index.ts, n-4 package.json
    private static final String PROJECT = "project/\n├── src/\n│   └── index.ts\n└── package.json";

    private TreeState state;

    @BeforeEach
    void setUp() {
        DirectoryStructureParser parser = new DirectoryStructureParser(new SequentialNodeIdGenerator("n-"));
        List<TreeNode> forest = ((ParseOutcome.Parsed) parser.parse(PROJECT)).forest();
        state = TreeStateEngine.apply(TreeState.EMPTY, new TreeAction.ReplaceForest(forest));
    }

    @Test
    void replaceForest_clearsSelection() {
        TreeState selected = TreeStateEngine.apply(state, new TreeAction.Select("n-3"));

        TreeState replaced = TreeStateEngine.apply(selected, new TreeAction.ReplaceForest(List.of(TreeNode.file("x", "x.txt", 0))));

        assertThat(replaced.selectedId()).isNull();
        assertThat(replaced.forest()).extracting(TreeNode::name).containsExactly("x.txt");
    }

    @Test
    void toggleExpand_flipsFolderOnly() {
        TreeState collapsed = TreeStateEngine.apply(state, new TreeAction.ToggleExpand("n-2"));

        assertThat(TreeStateEngine.findById(collapsed.forest(), "n-2").expanded()).isFalse();
        assertThat(TreeStateEngine.findById(collapsed.forest(), "n-1").expanded()).isTrue();

        TreeState expanded = TreeStateEngine.apply(collapsed, new TreeAction.ToggleExpand("n-2"));
        assertThat(expanded).isEqualTo(state);
    }

    @Test
    void toggleExpand_onFileOrUnknownIdIsNoOp() {
        TreeState selected = TreeStateEngine.apply(state, new TreeAction.Select("n-3"));

        TreeState afterFile = TreeStateEngine.apply(selected, new TreeAction.ToggleExpand("n-3"));
        TreeState afterUnknown = TreeStateEngine.apply(selected, new TreeAction.ToggleExpand("missing"));

        assertThat(afterFile).isEqualTo(selected);
        assertThat(afterFile.forest()).isSameAs(selected.forest());
        assertThat(afterUnknown.forest()).isSameAs(selected.forest());
    }

    @Test
    void rename_changesOnlyTargetNode() {
        TreeState renamed = TreeStateEngine.apply(state, new TreeAction.Rename("n-3", "main.ts"));

        assertThat(TreeStateEngine.findById(renamed.forest(), "n-3").name()).isEqualTo("main.ts");
        assertThat(TreeStateEngine.findById(renamed.forest(), "n-4")).isSameAs(TreeStateEngine.findById(state.forest(), "n-4"));
        assertThat(TreeStateEngine.findById(state.forest(), "n-3").name()).isEqualTo("index.ts");
    }

    @Test
    void rename_toCurrentNameLeavesForestUnchanged() {
        TreeState renamed = TreeStateEngine.apply(state, new TreeAction.Rename("n-2", "src"));

        assertThat(renamed).isEqualTo(state);
    }

    @Test
    void rename_worksOnFoldersAndDoesNotValidateName() {
        TreeState renamed = TreeStateEngine.apply(state, new TreeAction.Rename("n-1", ""));

        assertThat(renamed.forest().get(0).name()).isEmpty();
        assertThat(renamed.forest().get(0).children()).hasSize(2);
    }

    @Test
    void delete_selectedNodeClearsSelection() {
        TreeState selected = TreeStateEngine.apply(state, new TreeAction.Select("n-4"));

        TreeState deleted = TreeStateEngine.apply(selected, new TreeAction.Delete("n-4"));

        assertThat(deleted.selectedId()).isNull();
        assertThat(deleted.forest().get(0).children()).extracting(TreeNode::name).containsExactly("src");
    }

    @Test
    void delete_otherNodeKeepsSelection() {
        TreeState selected = TreeStateEngine.apply(state, new TreeAction.Select("n-4"));

        TreeState deleted = TreeStateEngine.apply(selected, new TreeAction.Delete("n-3"));

        assertThat(deleted.selectedId()).isEqualTo("n-4");
    }

    @Test
    void delete_folderRemovesWholeSubtree() {
        TreeState deleted = TreeStateEngine.apply(state, new TreeAction.Delete("n-2"));

        assertThat(TreeStateEngine.findById(deleted.forest(), "n-2")).isNull();
        assertThat(TreeStateEngine.findById(deleted.forest(), "n-3")).isNull();
        assertThat(deleted.nodeCount()).isEqualTo(2);
        assertThat(state.nodeCount()).isEqualTo(4);
    }

    @Test
    void delete_rootNodeAndUnknownId() {
        assertThat(TreeStateEngine.apply(state, new TreeAction.Delete("n-1")).forest()).isEmpty();
        assertThat(TreeStateEngine.apply(state, new TreeAction.Delete("missing")).forest()).isSameAs(state.forest());
    }

    @Test
    void select_isUnconditional() {
        assertThat(TreeStateEngine.apply(state, new TreeAction.Select("not-there")).selectedId()).isEqualTo("not-there");

        TreeState selected = TreeStateEngine.apply(state, new TreeAction.Select("n-2"));
        assertThat(TreeStateEngine.apply(selected, new TreeAction.Select(null)).selectedId()).isNull();
    }

    @Test
    void findById_searchesNestedLevels() {
        assertThat(TreeStateEngine.findById(state.forest(), "n-3").name()).isEqualTo("index.ts");
        assertThat(TreeStateEngine.findById(state.forest(), "missing")).isNull();
        assertThat(TreeStateEngine.findById(state.forest(), null)).isNull();
    }

    @Test
    void apply_treatsNullStateAsEmpty() {
        TreeState selected = TreeStateEngine.apply(null, new TreeAction.Select("a"));

        assertThat(selected.forest()).isEmpty();
        assertThat(selected.selectedId()).isEqualTo("a");
    }
}
