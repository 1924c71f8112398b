package com.chih.JSugar.core.exception;

/**
 * 未注册的指令名称，可能附带 "Did you mean" 建议
 */
public class UnknownDirectiveException extends SyntaxException {

    private final String directiveName;
    private final String suggestion;

    public UnknownDirectiveException(String directiveName, String suggestion) {
        super(buildMessage(directiveName, suggestion));
        this.directiveName = directiveName;
        this.suggestion = suggestion;
    }

    public String getDirectiveName() {
        return directiveName;
    }

    /**
     * @return 最接近的已知名称，没有合适候选时为 null
     */
    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String directiveName, String suggestion) {
        String message = "Unknown directive \"" + directiveName + "\"";
        if (suggestion != null) {
            message += ". Did you mean \"" + suggestion + "\"?";
        }
        return message;
    }
}
