package com.chih.JSugar.core.spi;

import com.chih.JSugar.core.ast.DocumentNode;

/**
 * 模板解析器 SPI
 * 把模板源码解析为节点树，交给编译器改写
 *
 * @author lizhiyuan
 * @since 2026/01/17
 */
public interface TemplateParser {

    /**
     * @param source       模板源码
     * @param templatePath 模板路径，用于错误定位
     * @return 文档根节点
     * @throws com.chih.JSugar.core.exception.SyntaxException 源码无法解析
     */
    DocumentNode parse(String source, String templatePath);
}
