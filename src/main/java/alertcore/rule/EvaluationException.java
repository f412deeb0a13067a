package alertcore.rule;

/**
 * 规则执行异常 - 指标源查询失败或超时，可恢复
 */
public class EvaluationException extends RuntimeException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
