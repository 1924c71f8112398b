package com.chih.JSugar.core.compiler;

import com.chih.JSugar.core.ast.DirectiveNode;
import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.ast.Node;
import com.chih.JSugar.core.ast.ParentNode;
import com.chih.JSugar.core.domain.CompilerConfig;
import com.chih.JSugar.core.exception.TemplateException;
import com.chih.JSugar.core.impl.NoOpCompileMetrics;
import com.chih.JSugar.core.pipeline.AstPipeline;
import com.chih.JSugar.core.pipeline.PipelineResult;
import com.chih.JSugar.core.spi.CompileMetrics;
import com.chih.JSugar.core.spi.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 编译入口：解析（可选）→ 标记模板路径 → 执行管线 → 校验结果
 * <p>
 * 管线在构造时组装一次，之后的编译互不干扰，可以并发调用。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public class TemplateCompiler {

    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private final AstPipeline pipeline;
    private final CompilerConfig config;
    private final TemplateParser parser;
    private final CompileMetrics metrics;

    public TemplateCompiler(CompilerPipelineFactory factory) {
        this(factory, null, new NoOpCompileMetrics());
    }

    public TemplateCompiler(CompilerPipelineFactory factory, TemplateParser parser) {
        this(factory, parser, new NoOpCompileMetrics());
    }

    public TemplateCompiler(CompilerPipelineFactory factory, TemplateParser parser, CompileMetrics metrics) {
        this.pipeline = factory.create();
        this.config = factory.getConfig();
        this.parser = parser;
        this.metrics = metrics != null ? metrics : new NoOpCompileMetrics();
    }

    /**
     * 解析并编译模板源码
     *
     * @throws IllegalStateException 没有配置解析器
     */
    public DocumentNode compile(String source, String templatePath) {
        if (parser == null) {
            throw new IllegalStateException("No TemplateParser configured, compile a parsed DocumentNode instead");
        }
        long start = System.nanoTime();
        DocumentNode document;
        try {
            document = parser.parse(source, templatePath);
        } catch (TemplateException e) {
            metrics.recordCompile(templatePath, System.nanoTime() - start, false);
            log.error("Failed to parse template: {}", templatePath, e);
            throw e;
        }
        return compile(document, new CompilationContext(templatePath, source, config.isDebug()), start);
    }

    /**
     * 编译已解析的文档
     */
    public DocumentNode compile(DocumentNode document, String templatePath) {
        return compile(document, new CompilationContext(templatePath, null, config.isDebug()), System.nanoTime());
    }

    private DocumentNode compile(DocumentNode document, CompilationContext context, long start) {
        context.stampTemplatePath(document);

        PipelineResult result = pipeline.run(document, context);
        long duration = System.nanoTime() - start;
        metrics.recordCompile(context.getTemplatePath(), duration, result.isSuccess());

        if (!result.isSuccess()) {
            TemplateException error = result.getError();
            if (error.getSnippet() != null) {
                log.error("Failed to compile template: {}\n{}", context.getTemplatePath(), error.getSnippet(), error);
            } else {
                log.error("Failed to compile template: {}", context.getTemplatePath(), error);
            }
            throw error;
        }

        DocumentNode compiled = result.getDocument();
        ensureNoDirectives(compiled);
        log.debug("Compiled template {} in {} ms", context.getTemplatePath(), duration / 1_000_000);
        return compiled;
    }

    private void ensureNoDirectives(Node node) {
        if (node instanceof DirectiveNode directive) {
            throw new IllegalStateException("Directive \"" + directive.getName() + "\" at " + directive.getLine()
                    + ":" + directive.getColumn() + " was not compiled");
        }
        if (node instanceof ParentNode parent) {
            for (Node child : parent.getChildren()) {
                ensureNoDirectives(child);
            }
        }
    }
}
