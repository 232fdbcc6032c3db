package github.yuhongye.hellovm.meta;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * class 文件的 major version 与 JDK 版本的对应关系
 */
@AllArgsConstructor
@Getter
public enum JDKVersion {
    JAVA_1_1(45, "Java 1.1"),
    JAVA_1_2(46, "Java 1.2"),
    JAVA_1_3(47, "Java 1.3"),
    JAVA_1_4(48, "Java 1.4"),
    JAVA_5(  49, "Java 5"),
    JAVA_6(  50, "Java 6"),
    JAVA_7(  51, "Java 7"),
    JAVA_8(  52, "Java 8"),
    JAVA_9(  53, "Java 9"),
    JAVA_10( 54, "Java 10"),
    JAVA_11( 55, "Java 11"),
    JAVA_12( 56, "Java 12"),
    JAVA_13( 57, "Java 13"),
    JAVA_14( 58, "Java 14"),
    JAVA_15( 59, "Java 15"),
    JAVA_16( 60, "Java 16"),
    JAVA_17( 61, "Java 17"),
    JAVA_18( 62, "Java 18"),
    JAVA_19( 63, "Java 19"),
    JAVA_20( 64, "Java 20"),
    JAVA_21( 65, "Java 21"),
    ;

    private int major;
    private String jdkName;

    @Override
    public String toString() {
        return jdkName;
    }

    /**
     * 版本号只用来打日志, 不认识的版本不算错误
     */
    public static Optional<JDKVersion> getByMajor(int major) {
        for (JDKVersion o : values()) {
            if (o.major == major) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
