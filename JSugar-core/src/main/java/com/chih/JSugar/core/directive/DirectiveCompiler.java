package com.chih.JSugar.core.directive;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.compiler.CompilationContext;

import java.util.List;
import java.util.Optional;

/**
 * 指令编译器 SPI
 * <p>
 * 把一个 {@link DirectiveNode} 编译为替换它的节点列表（通常是宿主代码与原子节点的交错序列）。
 * 附加能力以显式的可选值声明，不依赖接口探测：
 * </p>
 * <ul>
 *     <li>{@link #getPairingDirectives()}：可以配对的后继指令名</li>
 *     <li>{@link #getElementClaim()}：是否可以写成自定义元素</li>
 *     <li>{@link #getAttributeMergePolicy()}：属性指令的合并策略</li>
 *     <li>{@link #getElementExtraction()}：在元素上时自行改写元素（s:tag、s:ifcontent）</li>
 *     <li>{@link #removesContentWrapper()}：内容修饰，去掉内容指令外层的元素（s:nowrap）</li>
 * </ul>
 * <p>
 * 属性类指令（{@link DirectiveType#ATTRIBUTE}）返回 {@code HostCodeNode}：
 * {@code name="expr"} 形式表示命名属性，其他内容表示运行时展开的属性片段。
 * </p>
 * 实现必须是无状态的，同一个实例会被并发的编译共享。
 *
 * @author lizhiyuan
 * @since 2026/01/14
 */
public interface DirectiveCompiler {

    DirectiveType getType();

    /**
     * @throws com.chih.JSugar.core.exception.SyntaxException 指令用法错误
     */
    List<Node> compile(DirectiveNode node, CompilationContext context);

    /**
     * @return 按优先顺序排列的后继指令名，空列表表示不参与配对
     */
    default List<String> getPairingDirectives() {
        return List.of();
    }

    default Optional<ElementClaim> getElementClaim() {
        return Optional.empty();
    }

    default Optional<AttributeMergePolicy> getAttributeMergePolicy() {
        return Optional.empty();
    }

    default Optional<ElementExtraction> getElementExtraction() {
        return Optional.empty();
    }

    /**
     * @return true 时同一元素上的内容指令直接输出内容，不保留元素本身
     */
    default boolean removesContentWrapper() {
        return false;
    }
}
