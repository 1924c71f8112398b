package com.chih.JSugar.core.pass.directive;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.ParentNode;
import com.chih.JSugar.core.directive.DirectiveClassifier;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.NodeAction;
import com.chih.JSugar.core.pipeline.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 指令配对：把领头指令与同一父节点下的后继指令（else、finally、empty 等）链接起来
 * <p>
 * 领头指令链接到其后最近的、名称在后继列表中且尚未被认领的兄弟指令节点，中间可以隔着任意节点。
 * 从右往左处理，因此嵌套的链先完成配对，{@code if / if / else} 中 else 属于第二个 if。
 * 被认领的后继标记为已消费，编译阶段会把它移除，由领头指令统一编译整条链。
 * </p>
 * <p>
 * 配对完成后，每条链的后继会被移动到领头指令之前，这样后继的子树会在领头指令的 after 钩子之前遍历完成。
 * 链之间的其他节点保持原有位置，输出位置仍然在整条链之后。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/16
 */
public class DirectivePairingPass implements AstPass {

    private static final Logger log = LoggerFactory.getLogger(DirectivePairingPass.class);

    private final DirectiveClassifier classifier;

    public DirectivePairingPass(DirectiveClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public NodeAction before(Node node, PipelineContext context) {
        if (!(node instanceof ParentNode parent)) {
            return NodeAction.none();
        }

        List<Node> children = parent.getChildren();
        boolean linked = false;
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i) instanceof DirectiveNode leader && link(leader, parent)) {
                linked = true;
            }
        }

        if (linked) {
            parent.setChildren(moveFollowersBeforeHeads(children));
        }
        return NodeAction.none();
    }

    private boolean link(DirectiveNode leader, ParentNode parent) {
        if (leader.getPairedSibling() != null) {
            return false;
        }
        List<String> followers = classifier.pairingFollowers(leader.getName());
        if (followers.isEmpty()) {
            return false;
        }

        Node match = parent.findNextSibling(leader, candidate -> candidate instanceof DirectiveNode directive
                && !directive.isConsumedByPairing()
                && followers.contains(directive.getName()));
        if (!(match instanceof DirectiveNode follower)) {
            return false;
        }

        leader.setPairedSibling(follower);
        follower.markConsumedByPairing();
        log.trace("Paired {} at {}:{} with {} at {}:{}", leader.getName(), leader.getLine(),
                leader.getColumn(), follower.getName(), follower.getLine(), follower.getColumn());
        return true;
    }

    private List<Node> moveFollowersBeforeHeads(List<Node> children) {
        Set<Node> moved = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Node> result = new ArrayList<>(children.size());

        for (Node child : children) {
            if (child instanceof DirectiveNode directive) {
                if (directive.isConsumedByPairing()) {
                    if (moved.add(directive)) {
                        // the head was not found in this list, keep the follower in place
                        result.add(directive);
                    }
                    continue;
                }

                DirectiveNode follower = directive.getPairedSibling();
                while (follower != null) {
                    if (moved.add(follower)) {
                        result.add(follower);
                    }
                    follower = follower.getPairedSibling();
                }
            }
            result.add(child);
        }
        return result;
    }
}
