package github.yuhongye.hellovm.exceptions;

import lombok.Getter;

/**
 * 解析器和解释器抛出的唯一异常类型, 通过 {@link ErrorCode} 区分错误种类.
 */
@Getter
public class VmException extends RuntimeException {
    private final ErrorCode code;

    public VmException(ErrorCode code, String message) {
        super(code.getComment() + message);
        this.code = code;
    }

    public VmException(ErrorCode code, String message, Throwable cause) {
        super(code.getComment() + message, cause);
        this.code = code;
    }

    public static VmException of(ErrorCode code, String format, Object... args) {
        return new VmException(code, String.format(format, args));
    }
}
