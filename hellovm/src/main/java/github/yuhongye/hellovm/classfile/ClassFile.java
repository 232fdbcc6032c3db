package github.yuhongye.hellovm.classfile;

import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import github.yuhongye.hellovm.meta.JDKVersion;
import github.yuhongye.hellovm.parser.ConstantPool;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Java class 文件结构
 * class file {
 *     u4 magic;
 *
 *     u2 minor_version;
 *     u2 major_version;
 *
 *     u2 constant_pool_count;
 *     cp_info constant_pool[constant_pool_count - 1]; // 索引从1-constant_pool_count-1, 0 属性保留索引
 *
 *     u2 access_flags;
 *
 *     u2 this_class;
 *     u2 super_class;
 *     u2 interface_count;
 *     u2 interfaces[interface_count];
 *
 *     u2 fields_count;
 *     field_info fields[fields_count];
 *
 *     u2 methods_count;
 *     method_info = methods[methods_count];
 *
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 * 接口和字段暂不支持, 所以没有对应的成员.
 */
@Getter
public class ClassFile {
    public static final byte[] MAGIC = {(byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE};

    public static final String MAIN_METHOD = "main";

    private final byte[] magic;
    private final int minorVersion;
    private final int majorVersion;
    private final ConstantPool constantPool;
    private final Set<ClassAcc> accessFlags;
    private final int thisClass;
    private final int superClass;
    private final List<MethodInfo> methods;
    private final List<AttributeInfo> attributes;

    public ClassFile(byte[] magic, int minorVersion, int majorVersion, ConstantPool constantPool,
                     Set<ClassAcc> accessFlags, int thisClass, int superClass,
                     List<MethodInfo> methods, List<AttributeInfo> attributes) {
        this.magic = magic.clone();
        this.minorVersion = minorVersion;
        this.majorVersion = majorVersion;
        this.constantPool = constantPool;
        this.accessFlags = accessFlags;
        this.thisClass = thisClass;
        this.superClass = superClass;
        this.methods = ImmutableList.copyOf(methods);
        this.attributes = ImmutableList.copyOf(attributes);
    }

    public byte[] getMagic() {
        return magic.clone();
    }

    public boolean hasValidMagic() {
        return Arrays.equals(MAGIC, magic);
    }

    public String getThisClassName() {
        return constantPool.resolveClassName(thisClass);
    }

    public String getSuperClassName() {
        return constantPool.resolveClassName(superClass);
    }

    public Optional<JDKVersion> getJdkVersion() {
        return JDKVersion.getByMajor(majorVersion);
    }

    public Optional<MethodInfo> findMethod(String name) {
        return methods.stream().filter(m -> m.getName().equals(name)).findFirst();
    }

    public Optional<MethodInfo> getMainMethod() {
        return findMethod(MAIN_METHOD);
    }

    public Optional<SourceFileAttr> getSourceFile() {
        return attributes.stream()
                .filter(SourceFileAttr.class::isInstance)
                .map(SourceFileAttr.class::cast)
                .findFirst();
    }

    @Override
    public String toString() {
        return "ClassFile(magic=" + BaseEncoding.base16().encode(magic)
                + ", version=" + majorVersion + "." + minorVersion
                + ", accessFlags=" + accessFlags
                + ", thisClass=#" + thisClass
                + ", superClass=#" + superClass
                + ", methods=" + methods
                + ", attributes=" + attributes + ")";
    }
}
