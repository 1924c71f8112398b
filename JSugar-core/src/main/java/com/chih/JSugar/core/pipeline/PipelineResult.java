package com.chih.JSugar.core.pipeline;

import com.chih.JSugar.core.ast.DocumentNode;
import com.chih.JSugar.core.exception.TemplateException;

/**
 * 管线执行结果：成功时是改写后的文档，失败时是第一个错误（已附加位置）
 */
public final class PipelineResult {

    private final DocumentNode document;
    private final TemplateException error;

    private PipelineResult(DocumentNode document, TemplateException error) {
        this.document = document;
        this.error = error;
    }

    public static PipelineResult success(DocumentNode document) {
        return new PipelineResult(document, null);
    }

    public static PipelineResult failure(TemplateException error) {
        return new PipelineResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public DocumentNode getDocument() {
        if (error != null) {
            throw new IllegalStateException("Pipeline failed, no document available", error);
        }
        return document;
    }

    public TemplateException getError() {
        return error;
    }

    /**
     * @return 文档；失败时抛出携带位置的错误
     */
    public DocumentNode orElseThrow() {
        if (error != null) {
            throw error;
        }
        return document;
    }
}
