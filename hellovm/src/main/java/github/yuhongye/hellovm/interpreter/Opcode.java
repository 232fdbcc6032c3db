package github.yuhongye.hellovm.interpreter;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 解释器支持的指令. operandSize 是紧跟在操作码后面的操作数字节数
 */
@AllArgsConstructor
@Getter
public enum Opcode {
    LDC(          0x12, 1, "ldc"),
    /** 只认作字节码末尾的结束标记 */
    RETURN(       0xB1, 0, "return"),
    GETSTATIC(    0xB2, 2, "getstatic"),
    INVOKEVIRTUAL(0xB6, 2, "invokevirtual"),
    ;

    private int code;
    private int operandSize;
    private String mnemonic;

    private static final Map<Integer, Opcode> code2Enum = new HashMap<>();
    static {
        for (Opcode op : values()) {
            code2Enum.put(op.code, op);
        }
    }

    /**
     * @return 不支持的操作码返回 null
     */
    public static Opcode getByCode(int code) {
        return code2Enum.get(code);
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
