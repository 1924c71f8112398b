package com.chih.JSugar.core.compiler;

import com.chih.JSugar.core.directive.DirectiveClassifier;
import com.chih.JSugar.core.directive.DirectiveRegistry;
import com.chih.JSugar.core.domain.CompilerConfig;
import com.chih.JSugar.core.pass.context.ContextAnalysisPass;
import com.chih.JSugar.core.pass.directive.DirectiveCompilationPass;
import com.chih.JSugar.core.pass.directive.DirectiveExtractionPass;
import com.chih.JSugar.core.pass.directive.DirectivePairingPass;
import com.chih.JSugar.core.pass.element.ElementRoutingPass;
import com.chih.JSugar.core.pipeline.AstPass;
import com.chih.JSugar.core.pipeline.AstPipeline;
import com.chih.JSugar.core.pipeline.PassPriority;
import com.chih.JSugar.core.support.DirectivePrefixHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装标准编译管线：
 * <ol>
 *     <li>{@link ElementRoutingPass}（{@value PassPriority#ELEMENT_ROUTING}）</li>
 *     <li>{@link DirectiveExtractionPass}（{@value PassPriority#DIRECTIVE_EXTRACTION}）</li>
 *     <li>{@link DirectivePairingPass}（{@value PassPriority#DIRECTIVE_PAIRING}）</li>
 *     <li>{@link DirectiveCompilationPass}（{@value PassPriority#DIRECTIVE_COMPILATION}）</li>
 *     <li>{@link ContextAnalysisPass}（{@value PassPriority#CONTEXT_ANALYSIS}）</li>
 * </ol>
 * 自定义 Pass 按各自的优先级插入。
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public class CompilerPipelineFactory {

    private final DirectiveRegistry registry;
    private final CompilerConfig config;
    private final List<CustomPass> customPasses = new ArrayList<>();

    public CompilerPipelineFactory(DirectiveRegistry registry, CompilerConfig config) {
        config.validate();
        this.registry = registry;
        this.config = config;
    }

    /**
     * 追加自定义 Pass，可链式调用
     */
    public CompilerPipelineFactory withPass(AstPass pass, int priority) {
        customPasses.add(new CustomPass(pass, priority));
        return this;
    }

    public DirectiveClassifier createClassifier() {
        DirectivePrefixHelper prefixHelper = new DirectivePrefixHelper(config.getDirectivePrefix(),
                config.getElementPrefix());
        return new DirectiveClassifier(registry, prefixHelper, config.getSuggestionDistance());
    }

    public AstPipeline create() {
        DirectiveClassifier classifier = createClassifier();

        AstPipeline pipeline = new AstPipeline()
                .addPass(new ElementRoutingPass(classifier), PassPriority.ELEMENT_ROUTING)
                .addPass(new DirectiveExtractionPass(registry, classifier, config.getFragmentElement()),
                        PassPriority.DIRECTIVE_EXTRACTION)
                .addPass(new DirectivePairingPass(classifier), PassPriority.DIRECTIVE_PAIRING)
                .addPass(new DirectiveCompilationPass(registry), PassPriority.DIRECTIVE_COMPILATION)
                .addPass(new ContextAnalysisPass(), PassPriority.CONTEXT_ANALYSIS);

        for (CustomPass custom : customPasses) {
            pipeline.addPass(custom.pass(), custom.priority());
        }
        return pipeline;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public DirectiveRegistry getRegistry() {
        return registry;
    }

    private record CustomPass(AstPass pass, int priority) {
    }
}
