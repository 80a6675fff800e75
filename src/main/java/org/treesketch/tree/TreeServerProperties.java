package org.treesketch.tree;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import org.treesketch.tree.format.FormatStyle;

/**
 * 目录树 MCP Server 的业务配置（{@code app.tree.*}）。
 */
@Validated
@ConfigurationProperties(prefix = "app.tree")
public class TreeServerProperties {

    /**
     * {@code tree_parse} 单次允许的最大输入字符数（上限保护）。
     */
    @Min(1)
    @Max(10_000_000)
    private int maxInputChars = 200_000;

    /**
     * 节点 id 生成策略。
     * <p>
     * {@code random}：{@code 前缀 + UUID}；{@code sequential}：{@code 前缀 + 递增序号}（便于调试时阅读）。
     */
    @NotNull
    private IdStrategy idStrategy = IdStrategy.RANDOM;

    /**
     * 节点 id 前缀。
     */
    @NotNull
    private String idPrefix = "node-";

    /**
     * {@code tree_format} 未指定风格时使用的默认风格（markdown/ascii）。
     */
    @NotNull
    private FormatStyle formatDefaultStyle = FormatStyle.MARKDOWN;

    /**
     * Markdown 输出时每级缩进的空格数。
     */
    @Min(1)
    @Max(8)
    private int formatIndentWidth = 2;

    public enum IdStrategy {
        RANDOM,
        SEQUENTIAL
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public IdStrategy getIdStrategy() {
        return idStrategy;
    }

    public void setIdStrategy(IdStrategy idStrategy) {
        this.idStrategy = idStrategy;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public void setIdPrefix(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public FormatStyle getFormatDefaultStyle() {
        return formatDefaultStyle;
    }

    public void setFormatDefaultStyle(FormatStyle formatDefaultStyle) {
        this.formatDefaultStyle = formatDefaultStyle;
    }

    public int getFormatIndentWidth() {
        return formatIndentWidth;
    }

    public void setFormatIndentWidth(int formatIndentWidth) {
        this.formatIndentWidth = formatIndentWidth;
    }
}
