package github.yuhongye.hellovm;

import github.yuhongye.hellovm.classfile.ClassFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 启动参数
 */
@AllArgsConstructor
@Builder
@Getter
@ToString
public class VmOptions {
    public static final String USAGE =
            "usage: hellovm <class-file> [--entry=<method>] [--expect-this=<class>] [--expect-super=<class>] [--dump]";

    private Path classFile;

    @Builder.Default
    private String entryPoint = ClassFile.MAIN_METHOD;

    /**
     * 为 null 时不检查当前类名
     */
    private String expectedThisClass;

    @Builder.Default
    private String expectedSuperClass = "java/lang/Object";

    /**
     * 解析完成后打印整个 class 文件和常量池
     */
    private boolean dump;

    /**
     * @throws IllegalArgumentException 参数不合法
     */
    public static VmOptions parse(String... args) {
        VmOptionsBuilder builder = VmOptions.builder();
        for (String arg : args) {
            if (arg.equals("--dump")) {
                builder.dump(true);
            } else if (arg.startsWith("--entry=")) {
                builder.entryPoint(value(arg));
            } else if (arg.startsWith("--expect-this=")) {
                builder.expectedThisClass(value(arg));
            } else if (arg.startsWith("--expect-super=")) {
                builder.expectedSuperClass(value(arg));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown option " + arg);
            } else if (builder.classFile != null) {
                throw new IllegalArgumentException("more than one class file: " + arg);
            } else {
                builder.classFile(Paths.get(arg));
            }
        }
        if (builder.classFile == null) {
            throw new IllegalArgumentException("missing class file");
        }
        return builder.build();
    }

    private static String value(String arg) {
        String v = arg.substring(arg.indexOf('=') + 1);
        if (v.isEmpty()) {
            throw new IllegalArgumentException("empty value for " + arg);
        }
        return v;
    }
}
