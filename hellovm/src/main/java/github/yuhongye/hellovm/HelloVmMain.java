package github.yuhongye.hellovm;

import github.yuhongye.hellovm.classfile.ClassFile;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import github.yuhongye.hellovm.interpreter.Interpreter;
import github.yuhongye.hellovm.parser.ClassParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;

/**
 * 读取一个 class 文件, 做完基本检查后执行它的入口方法
 */
@Slf4j
public class HelloVmMain {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(System.out, args));
    }

    static int run(PrintStream out, String... args) {
        VmOptions options;
        try {
            options = VmOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}\n{}", e.getMessage(), VmOptions.USAGE);
            return EXIT_USAGE;
        }

        try {
            ClassFile classFile = ClassParser.parse(options.getClassFile());
            if (options.isDump()) {
                log.info("{} file: {}", options.getClassFile(), classFile);
                log.info("{}", classFile.getConstantPool());
            }
            check(classFile, options);
            new Interpreter(classFile, out).run(options.getEntryPoint());
            out.flush();
            return EXIT_OK;
        } catch (VmException e) {
            log.error("Failed to run {} [{}]: {}", options.getClassFile(), e.getCode(), e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to read {}", options.getClassFile(), e);
            return EXIT_FAILURE;
        }
    }

    /**
     * 不属于解析器的职责, 只是执行前的检查
     */
    static void check(ClassFile classFile, VmOptions options) {
        if (!classFile.hasValidMagic()) {
            throw new VmException(ErrorCode.INVALID_CLASS_FILE, "This is not valid class file format.");
        }
        String superClass = classFile.getSuperClassName();
        if (!superClass.equals(options.getExpectedSuperClass())) {
            throw VmException.of(ErrorCode.INVALID_CLASS_FILE, "super class is %s, expected %s",
                    superClass, options.getExpectedSuperClass());
        }
        String thisClass = classFile.getThisClassName();
        if (options.getExpectedThisClass() != null && !thisClass.equals(options.getExpectedThisClass())) {
            throw VmException.of(ErrorCode.INVALID_CLASS_FILE, "this class is %s, expected %s",
                    thisClass, options.getExpectedThisClass());
        }
        log.info("Loaded class {} extends {}", thisClass, superClass);
    }
}
