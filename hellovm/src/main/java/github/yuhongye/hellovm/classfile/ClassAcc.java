package github.yuhongye.hellovm.classfile;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@AllArgsConstructor
@Getter
public enum ClassAcc {
    ACC_PUBLIC(    0x0001, "声明为public, 可以包外访问"),
    ACC_FINAL(     0x0010, "声明为final, 不允许有子类"),
    ACC_SUPER(     0x0020, "不再使用(JDK 1.0.2之前使用)"),
    ACC_INTERFACE( 0x0200, "该类文件定义的是接口而不是类"),
    ACC_ABSTRACT(  0x0400, "声明为abstract，不能被实例化"),
    ACC_SYNTHETIC( 0x1000, "表明该class文件并非由Java源代码生成"),
    ACC_ANNOTATION(0x2000, "标识注解类型"),
    ACC_ENUM(      0x4000, "标识枚举类型")
    ;

    private int mask;
    private String desc;

    /**
     * @return accessFlag 中所有被设置的标志, 按照枚举声明的顺序
     */
    public static Set<ClassAcc> decode(int accessFlag) {
        Set<ClassAcc> flags = EnumSet.noneOf(ClassAcc.class);
        Arrays.stream(values())
                .filter(acc -> (acc.mask & accessFlag) != 0)
                .forEach(flags::add);
        return flags;
    }

    public static String toString(int accessFlag) {
        return decode(accessFlag).stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", "));
    }
}
