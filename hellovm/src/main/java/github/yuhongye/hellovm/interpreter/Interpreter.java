package github.yuhongye.hellovm.interpreter;

import com.google.common.base.Preconditions;
import github.yuhongye.hellovm.bytes.ByteReader;
import github.yuhongye.hellovm.classfile.ClassFile;
import github.yuhongye.hellovm.classfile.CodeAttr;
import github.yuhongye.hellovm.classfile.MethodInfo;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import github.yuhongye.hellovm.parser.ConstVal;
import github.yuhongye.hellovm.parser.ConstantPool;
import github.yuhongye.hellovm.parser.ConstantTag;
import github.yuhongye.hellovm.parser.NameAndType;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * 只认识 getstatic, ldc 和 invokevirtual 的字节码解释器, 足够运行一个 hello world.
 * 字节码的最后一个字节如果是 return, 只当作结束标记, 其他位置出现的 return 和未知指令一样报错.
 * 所有操作数都通过常量池解析, 唯一的副作用是 {@link NativeMethods} 中的方法向 out 输出.
 */
@Slf4j
public class Interpreter {
    private final ClassFile classFile;
    private final ConstantPool constantPool;
    private final PrintStream out;
    private final NativeMethods natives;

    public Interpreter(ClassFile classFile, PrintStream out) {
        this(classFile, out, NativeMethods.defaults());
    }

    public Interpreter(ClassFile classFile, PrintStream out, NativeMethods natives) {
        this.classFile = Preconditions.checkNotNull(classFile);
        this.constantPool = classFile.getConstantPool();
        this.out = Preconditions.checkNotNull(out);
        this.natives = Preconditions.checkNotNull(natives);
    }

    public void runMain() {
        run(ClassFile.MAIN_METHOD);
    }

    /**
     * 执行名为 methodName 的方法, 直到字节码结束
     */
    public void run(String methodName) {
        MethodInfo method = classFile.findMethod(methodName)
                .orElseThrow(() -> VmException.of(ErrorCode.MISSING_ENTRY_POINT, "no method %s in class #%d",
                        methodName, classFile.getThisClass()));
        CodeAttr code = method.getCode()
                .orElseThrow(() -> VmException.of(ErrorCode.MISSING_ENTRY_POINT, "method %s has no Code attribute",
                        methodName));
        log.debug("Run {}{}", method.getName(), method.getDescriptor());
        execute(code.getCode());
    }

    void execute(byte[] code) {
        ByteReader byteCode = ByteReader.of(code);
        OperandStack operandStack = new OperandStack();

        int end = code.length;
        if (end > 0 && Opcode.getByCode(code[end - 1] & 0xFF) == Opcode.RETURN) {
            end--;
        }

        while (byteCode.position() < end) {
            long pc = byteCode.position();
            int instruction = byteCode.readU1();
            Opcode opcode = Opcode.getByCode(instruction);
            if (opcode == null) {
                throw VmException.of(ErrorCode.UNIMPLEMENTED_OPCODE, "0x%02x at pc %d", instruction, pc);
            }
            log.trace("pc {}: {}", pc, opcode);

            switch (opcode) {
                case GETSTATIC:
                    getStatic(byteCode.readU2(), operandStack);
                    break;
                case LDC:
                    ldc(byteCode.readU1(), operandStack);
                    break;
                case INVOKEVIRTUAL:
                    invokeVirtual(byteCode.readU2(), operandStack);
                    break;
                default:
                    throw VmException.of(ErrorCode.UNIMPLEMENTED_OPCODE, "%s at pc %d", opcode, pc);
            }
        }
    }

    /**
     * 没有真正的静态字段, 压入一个带有字段类型的对象标记
     */
    private void getStatic(int fieldRefIndex, OperandStack operandStack) {
        ConstVal.RefInfo fieldRef = constantPool.getFieldref(fieldRefIndex);
        String owner = constantPool.resolveClassName(fieldRef.getClassIndex());
        NameAndType nameAndType = constantPool.resolveNameAndType(fieldRef.getNameAndTypeIndex());
        log.trace("getstatic {}.{}", owner, nameAndType);
        operandStack.push(StackEntry.instance(nameAndType.getDescriptor()));
    }

    private void ldc(int constantIndex, OperandStack operandStack) {
        ConstVal value = constantPool.get(constantIndex);
        if (!value.is(ConstantTag.CONSTANT_STRING_INFO)) {
            throw VmException.of(ErrorCode.UNSUPPORTED_FEATURE, "ldc of %s #%d", value.getTag(), constantIndex);
        }
        operandStack.push(StackEntry.ofString(constantPool.resolveString(constantIndex)));
    }

    private void invokeVirtual(int methodRefIndex, OperandStack operandStack) {
        ConstVal.RefInfo methodRef = constantPool.getMethodref(methodRefIndex);
        String owner = constantPool.resolveClassName(methodRef.getClassIndex());
        NameAndType nameAndType = constantPool.resolveNameAndType(methodRef.getNameAndTypeIndex());
        NativeMethodKey key = new NativeMethodKey(owner, nameAndType.getName(), nameAndType.getDescriptor());
        NativeMethod method = natives.lookup(key)
                .orElseThrow(() -> VmException.of(ErrorCode.UNSUPPORTED_FEATURE, "native method %s", key));
        method.invoke(operandStack, out);
    }
}
