package org.treesketch.tree.parse;

import org.junit.jupiter.api.Test;
import org.treesketch.tree.TreeNode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.treesketch.tree.parse.TreeAssertions.forestOf;
import static org.treesketch.tree.parse.TreeAssertions.reasonOf;

class DirectoryStructureParserTest {

    private final DirectoryStructureParser parser = new DirectoryStructureParser(new SequentialNodeIdGenerator("n-"));

    @Test
    void parse_rejectsEmptyInput() {
        assertThat(reasonOf(parser.parse(""))).isEqualTo(DirectoryStructureParser.EMPTY_INPUT).containsIgnoringCase("empty");
        assertThat(reasonOf(parser.parse("  \n\t "))).isEqualTo(DirectoryStructureParser.EMPTY_INPUT);
        assertThat(reasonOf(parser.parse(null))).isEqualTo(DirectoryStructureParser.EMPTY_INPUT);
    }

    @Test
    void parse_rejectsCommentOnlyInput() {
        assertThat(reasonOf(parser.parse("# just a note\n   # another"))).isEqualTo(DirectoryStructureParser.ONLY_COMMENTS);
        assertThat(reasonOf(parser.parse("│\n│   \n─"))).isEqualTo(DirectoryStructureParser.ONLY_COMMENTS);
    }

    @Test
    void parseWithReport_routesMixedInputToAsciiParser() {
        ParseReport report = parser.parseWithReport("- docs/\n├── readme.md");

        assertThat(report.format()).isEqualTo(InputFormat.ASCII);
        assertThat(report.outcome().isSuccess()).isTrue();
    }

    @Test
    void parseWithReport_countsDroppedLines() {
        String raw = """
                # layout
                - src/
                  - index.ts   # entry point

                │
                """;

        ParseReport report = parser.parseWithReport(raw);

        assertThat(report.format()).isEqualTo(InputFormat.MARKDOWN);
        assertThat(report.sanitizedLines()).isEqualTo(2);
        assertThat(report.droppedLines()).isEqualTo(2);
        TreeNode src = forestOf(report.outcome()).get(0);
        assertThat(src.children()).extracting(TreeNode::name).containsExactly("index.ts");
    }

    @Test
    void parse_markdownAndAsciiProduceSameShape() {
        List<TreeNode> fromMarkdown = forestOf(parser.parse("- project/\n  - src/\n    - index.ts\n  - package.json"));
        List<TreeNode> fromAscii = forestOf(parser.parse("project/\n├── src/\n│   └── index.ts\n└── package.json"));

        assertThat(shape(fromMarkdown)).isEqualTo(shape(fromAscii));
    }

    @Test
    void parse_generatesDistinctIdsAcrossParses() {
        DirectoryStructureParser randomIds = new DirectoryStructureParser(new RandomNodeIdGenerator("node-"));

        TreeNode first = forestOf(randomIds.parse("- a/\n  - b")).get(0);
        TreeNode second = forestOf(randomIds.parse("- a/\n  - b")).get(0);

        assertThat(first.id()).startsWith("node-").isNotEqualTo(second.id());
        assertThat(first.children().get(0).id()).isNotEqualTo(second.children().get(0).id());
    }

    @Test
    void parse_wrapsParserFaultsWithFormatPrefix() {
        DirectoryStructureParser failing = new DirectoryStructureParser(() -> {
            throw new IllegalStateException("boom");
        });

        assertThat(reasonOf(failing.parse("- a"))).isEqualTo("Failed to parse markdown format: boom");
        assertThat(reasonOf(failing.parse("└── a"))).isEqualTo("Failed to parse ASCII format: boom");
    }

    private static String shape(List<TreeNode> forest) {
        StringBuilder sb = new StringBuilder();
        for (TreeNode node : forest) {
            appendShape(node, sb);
        }
        return sb.toString();
    }

    private static void appendShape(TreeNode node, StringBuilder sb) {
        sb.append(node.depth()).append(':').append(node.kind()).append(':').append(node.name()).append('\n');
        if (node.isFolder()) {
            for (TreeNode child : node.children()) {
                appendShape(child, sb);
            }
        }
    }
}
