package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.exception.TemplateException;

import java.util.List;

/**
 * Pass 钩子对单个节点的处理结果
 * <ul>
 *     <li>{@link #none()}：无影响</li>
 *     <li>{@link #skipChildren()}：本次访问不再下降到子节点，after 钩子照常执行</li>
 *     <li>{@link #replace(List, boolean)}：用给定节点列表替换当前节点</li>
 *     <li>{@link #fail(TemplateException)}：终止整次编译</li>
 * </ul>
 * restart=false 时替换节点从下一个 Pass 继续，restart=true 时从同一个 Pass 重新开始。
 *
 * @author lizhiyuan
 * @since 2026/01/12
 */
public final class NodeAction {

    private static final NodeAction NONE = new NodeAction(null, false, false, null);
    private static final NodeAction SKIP_CHILDREN = new NodeAction(null, false, true, null);

    private final List<Node> replacement;
    private final boolean restart;
    private final boolean skipChildren;
    private final TemplateException error;

    private NodeAction(List<Node> replacement, boolean restart, boolean skipChildren, TemplateException error) {
        this.replacement = replacement;
        this.restart = restart;
        this.skipChildren = skipChildren;
        this.error = error;
    }

    public static NodeAction none() {
        return NONE;
    }

    public static NodeAction skipChildren() {
        return SKIP_CHILDREN;
    }

    public static NodeAction replace(Node... nodes) {
        return replace(List.of(nodes), false);
    }

    public static NodeAction replace(List<Node> nodes) {
        return replace(nodes, false);
    }

    public static NodeAction replace(List<Node> nodes, boolean restart) {
        if (nodes == null) {
            throw new IllegalArgumentException("replacement nodes must not be null");
        }
        return new NodeAction(List.copyOf(nodes), restart, false, null);
    }

    /**
     * 以错误值终止遍历，引擎会在错误缺少位置时附加当前节点的位置
     */
    public static NodeAction fail(TemplateException error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new NodeAction(null, false, false, error);
    }

    public boolean isReplacement() {
        return replacement != null;
    }

    public boolean isSkipChildren() {
        return skipChildren;
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean isNone() {
        return replacement == null && !skipChildren && error == null;
    }

    public List<Node> getReplacement() {
        return replacement;
    }

    public boolean isRestart() {
        return restart;
    }

    public TemplateException getError() {
        return error;
    }
}
