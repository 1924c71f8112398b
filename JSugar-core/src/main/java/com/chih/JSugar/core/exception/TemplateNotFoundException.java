package com.chih.JSugar.core.exception;

/**
 * 模板加载失败（由加载器等外部协作者抛出，核心遍历本身不会抛出）
 */
public class TemplateNotFoundException extends JSugarException {
    public TemplateNotFoundException(String templatePath) {
        super("Template not found: " + templatePath);
    }

    public TemplateNotFoundException(String templatePath, Throwable cause) {
        super("Template not found: " + templatePath, cause);
    }
}
