package github.yuhongye.hellovm.classfile;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static github.yuhongye.hellovm.classfile.AttributeType.Location.C;
import static github.yuhongye.hellovm.classfile.AttributeType.Location.CFM;
import static github.yuhongye.hellovm.classfile.AttributeType.Location.F;
import static github.yuhongye.hellovm.classfile.AttributeType.Location.M;

/**
 * class 文件中预定义的属性. 只有 ConstantValue, Code, SourceFile, LineNumberTable 会被解析成具体的结构,
 * 其余的属性和不认识的属性一样保存原始字节.
 */
@AllArgsConstructor
@Getter
public enum AttributeType {
    SOURCE_FILE           ("SourceFile",           C),
    INNER_CLASSES         ("InnerClasses",         C),
    ENCLOSING_METHOD      ("EnclosingMethod",      C),
    SOURCE_DEBUG_EXTENSION("SourceDebugExtension", C),
    BOOTSTRAP_METHODS     ("BootstrapMethods",     C),
    NEST_HOST             ("NestHost",             C),
    NEST_MEMBERS          ("NestMembers",          C),

    CONSTANT_VALUE("ConstantValue", F),

    CODE                                   ("Code",                                 M),
    EXCEPTIONS                             ("Exceptions",                           M),
    RUNTIME_VISIBLE_PARAMETER_ANNOTATIONS  ("RuntimeVisibleParameterAnnotations",   M),
    RUNTIME_INVISIBLE_PARAMETER_ANNOTATIONS("RuntimeInvisibleParameterAnnotations", M),
    ANNOTATION_DEFAULT                     ("AnnotationDefault",                    M),
    METHOD_PARAMETERS                      ("MethodParameters",                     M),

    SYNTHETIC                         ("Synthetic",                       CFM),
    DEPRECATED                        ("Deprecated",                      CFM),
    SIGNATURE                         ("Signature",                       CFM),
    RUNTIME_VISIBLE_ANNOTATIONS       ("RuntimeVisibleAnnotations",       CFM),
    RUNTIME_INVISIBLE_ANNOTATIONS     ("RuntimeInvisibleAnnotations",     CFM),
    RUNTIME_VISIBLE_TYPE_ANNOTATIONS  ("RuntimeVisibleTypeAnnotations",   CFM),
    RUNTIME_INVISIBLE_TYPE_ANNOTATIONS("RuntimeInvisibleTypeAnnotations", CFM),

    LINE_NUMBER_TABLE        ("LineNumberTable",        Location.CODE),
    LOCAL_VARIABLE_TABLE     ("LocalVariableTable",     Location.CODE),
    LOCAL_VARIABLE_TYPE_TABLE("LocalVariableTypeTable", Location.CODE),
    STACK_MAP_TABLE          ("StackMapTable",          Location.CODE),
    ;

    /**
     * 属性名字，非常重要，通过名字来判断是哪个属性
     */
    private String attributeName;

    /**
     * 属性出现的位置
     */
    private Location location;

    private static final Map<String, AttributeType> name2Instance = new HashMap<>();

    static {
        Arrays.stream(values()).forEach(attr -> name2Instance.put(attr.attributeName, attr));
    }

    public static Optional<AttributeType> getByName(String name) {
        return Optional.ofNullable(name2Instance.get(name));
    }

    public boolean isAllowedIn(Location where) {
        return location == where || (location == CFM && where != Location.CODE);
    }

    /**
     * Class文件中预定义的属性出现的位置: 类, 字段, 方法, 三者皆可, Code 属性内部
     */
    public enum Location {
        C, F, M, CFM, CODE;
    }
}
