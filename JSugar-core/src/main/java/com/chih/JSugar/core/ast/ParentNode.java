package com.chih.JSugar.core.ast;

import java.util.List;
import java.util.function.Predicate;

/**
 * 拥有有序子节点列表的复合节点
 */
public interface ParentNode {

    /**
     * @return 可变的子节点列表
     */
    List<Node> getChildren();

    /**
     * 整体替换子节点列表
     */
    void setChildren(List<Node> children);

    /**
     * 在 child 之后的兄弟节点中查找第一个满足条件的节点（按引用定位 child）。
     * 只在当前父节点的直接子节点中查找。
     *
     * @return 匹配的兄弟节点，找不到时为 null
     */
    default Node findNextSibling(Node child, Predicate<Node> predicate) {
        List<Node> children = getChildren();
        int index = indexOf(children, child);
        if (index < 0) {
            return null;
        }

        for (int i = index + 1; i < children.size(); i++) {
            Node candidate = children.get(i);
            if (predicate.test(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static int indexOf(List<Node> children, Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }
}
