package github.yuhongye.hellovm.parser;

import com.google.common.io.BaseEncoding;
import github.yuhongye.hellovm.bytes.ByteReader;
import github.yuhongye.hellovm.classfile.AttributeInfo;
import github.yuhongye.hellovm.classfile.AttributeType.Location;
import github.yuhongye.hellovm.classfile.ClassAcc;
import github.yuhongye.hellovm.classfile.ClassFile;
import github.yuhongye.hellovm.classfile.MethodAcc;
import github.yuhongye.hellovm.classfile.MethodInfo;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import github.yuhongye.hellovm.meta.JDKVersion;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_CLASS_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_DOUBLE_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_FIELDREF_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_FLOAT_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_INTEGER_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_INTERFACEMETHODREF_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_INVOKEDYNAMIC_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_LONG_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_METHODHANDLE_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_METHODREF_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_METHODTYPE_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_NAMEANDTYPE_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_STRING_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_UTF8_INFO;

/**
 * 按照 class 文件的顺序依次解析, 结构见 {@link ClassFile}.
 * 常量池解析完成之后, 方法和属性的名字都会立即通过常量池解析成字符串.
 */
@Slf4j
public class ClassParser {
    static final Map<ConstantTag, ReadConstant<ByteReader, ConstVal>> constantTagParser = new EnumMap<>(ConstantTag.class);
    static {
        constantTagParser.put(CONSTANT_INTEGER_INFO,            in -> new ConstVal(CONSTANT_INTEGER_INFO, in.readS4()));
        constantTagParser.put(CONSTANT_LONG_INFO,               in -> new ConstVal(CONSTANT_LONG_INFO, in.readS8()));
        constantTagParser.put(CONSTANT_FLOAT_INFO,              in -> new ConstVal(CONSTANT_FLOAT_INFO, in.readF4()));
        constantTagParser.put(CONSTANT_DOUBLE_INFO,             in -> new ConstVal(CONSTANT_DOUBLE_INFO, in.readF8()));

        constantTagParser.put(CONSTANT_UTF8_INFO,               ClassParser::readUtf8);
        constantTagParser.put(CONSTANT_STRING_INFO,             in -> new ConstVal(CONSTANT_STRING_INFO, in.readU2()));

        constantTagParser.put(CONSTANT_CLASS_INFO,              in -> new ConstVal(CONSTANT_CLASS_INFO, in.readU2()));

        constantTagParser.put(CONSTANT_NAMEANDTYPE_INFO,        ClassParser::readNameAndTypeInfo);

        constantTagParser.put(CONSTANT_FIELDREF_INFO,           in -> new ConstVal(CONSTANT_FIELDREF_INFO, readRefInfo(in)));
        constantTagParser.put(CONSTANT_METHODREF_INFO,          in -> new ConstVal(CONSTANT_METHODREF_INFO, readRefInfo(in)));
        constantTagParser.put(CONSTANT_INTERFACEMETHODREF_INFO, in -> new ConstVal(CONSTANT_INTERFACEMETHODREF_INFO, readRefInfo(in)));

        constantTagParser.put(CONSTANT_METHODTYPE_INFO,         ClassParser::readMethodType);
        constantTagParser.put(CONSTANT_METHODHANDLE_INFO,       ClassParser::readMethodHandle);
        constantTagParser.put(CONSTANT_INVOKEDYNAMIC_INFO,      ClassParser::readDynamic);
    }

    private final ByteReader in;

    public ClassParser(ByteReader in) {
        this.in = in;
    }

    public static ClassFile parse(InputStream in) {
        return new ClassParser(new ByteReader(in)).parse();
    }

    public static ClassFile parse(Path classFile) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(classFile))) {
            log.info("Parsing {}", classFile);
            return parse(in);
        }
    }

    public ClassFile parse() {
        byte[] magic = readMagic();
        int minor = in.readU2();
        int major = in.readU2();
        log.info("Major version: {}, minor version: {}, JDK VERSION: {}", major, minor,
                JDKVersion.getByMajor(major).map(JDKVersion::toString).orElse("unknown"));

        ConstantPool constantPool = readConstantPool();
        AttributeParser attributeParser = new AttributeParser(constantPool);

        int acc = in.readU2();
        Set<ClassAcc> accessFlags = ClassAcc.decode(acc);
        log.debug("Access flag: {}", ClassAcc.toString(acc));

        int thisClass = in.readU2();
        int superClass = in.readU2();
        log.debug("This class: #{}, super class: #{}", thisClass, superClass);

        checkInterfaces();
        checkFields();

        List<MethodInfo> methods = readMethods(constantPool, attributeParser);
        List<AttributeInfo> attributes = attributeParser.readAttributes(in, Location.C);

        if (!in.isExhausted()) {
            log.warn("{} bytes left after the last class attribute", in.remaining());
        }
        return new ClassFile(magic, minor, major, constantPool, accessFlags, thisClass, superClass, methods, attributes);
    }

    /**
     * 魔数只记录下来, 由调用方决定是否接受
     */
    private byte[] readMagic() {
        byte[] magic = in.readBytes(4);
        log.debug("Magic: 0x{}", BaseEncoding.base16().encode(magic));
        return magic;
    }

    /**
     * 常量池数量比实际的常量多1, long 和 double 各占两个位置
     */
    ConstantPool readConstantPool() {
        int count = in.readU2();
        log.debug("Constant pool count: {}", count);
        List<ConstVal> slots = new ArrayList<>(Math.max(count - 1, 0));
        int i = 1;
        while (i < count) {
            ConstVal value = readConstant(in);
            log.trace("#{} Read constant pool {}, value: {}", i, value.getTag(), value);
            slots.add(value);
            int slotSize = value.getTag().getSlotSize();
            for (int j = 1; j < slotSize; j++) {
                slots.add(null);
            }
            i += slotSize;
        }
        return new ConstantPool(slots);
    }

    static ConstVal readConstant(ByteReader in) {
        int tag = in.readU1();
        ConstantTag ctag = ConstantTag.getByTag(tag);
        if (ctag == null) {
            throw VmException.of(ErrorCode.MALFORMED_CONSTANT_POOL_TAG, "%d", tag);
        }
        return constantTagParser.get(ctag).read(in);
    }

    static ConstVal readUtf8(ByteReader in) {
        int length = in.readU2();
        return new ConstVal(CONSTANT_UTF8_INFO, in.readUtf8(length));
    }

    static ConstVal readNameAndTypeInfo(ByteReader in) {
        int nameIndex = in.readU2();
        int descIndex = in.readU2();
        return new ConstVal(CONSTANT_NAMEANDTYPE_INFO, new ConstVal.NameAndTypeInfo(nameIndex, descIndex));
    }

    static ConstVal.RefInfo readRefInfo(ByteReader in) {
        int classIndex = in.readU2();
        int nameAndTypeIndex = in.readU2();
        return new ConstVal.RefInfo(classIndex, nameAndTypeIndex);
    }

    static ConstVal readMethodType(ByteReader in) {
        return new ConstVal(CONSTANT_METHODTYPE_INFO, new ConstVal.MethodTypeInfo(in.readU2()));
    }

    static ConstVal readMethodHandle(ByteReader in) {
        int referenceKind = in.readU1();
        int referenceIndex = in.readU2();
        return new ConstVal(CONSTANT_METHODHANDLE_INFO, new ConstVal.MethodHandleInfo(referenceKind, referenceIndex));
    }

    static ConstVal readDynamic(ByteReader in) {
        int bootstrapMethodAttrIndex = in.readU2();
        int nameAndTypeIndex = in.readU2();
        return new ConstVal(CONSTANT_INVOKEDYNAMIC_INFO,
                new ConstVal.DynamicInfo(bootstrapMethodAttrIndex, nameAndTypeIndex));
    }

    /**
     * 接口表还没有实现, 只要有接口就失败, 不会读取接口下标
     */
    private void checkInterfaces() {
        int count = in.readU2();
        log.debug("Interface count: {}", count);
        if (count != 0) {
            throw VmException.of(ErrorCode.UNSUPPORTED_FEATURE, "class implements %d interfaces", count);
        }
    }

    private void checkFields() {
        int count = in.readU2();
        log.debug("Field count: {}", count);
        if (count != 0) {
            throw VmException.of(ErrorCode.UNSUPPORTED_FEATURE, "class declares %d fields", count);
        }
    }

    private List<MethodInfo> readMethods(ConstantPool constantPool, AttributeParser attributeParser) {
        int count = in.readU2();
        log.debug("Method count: {}", count);
        List<MethodInfo> methods = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            methods.add(readMethod(constantPool, attributeParser));
        }
        return methods;
    }

    private MethodInfo readMethod(ConstantPool constantPool, AttributeParser attributeParser) {
        int acc = in.readU2();
        int nameIndex = in.readU2();
        String name = constantPool.resolveUtf8(nameIndex);
        int descIndex = in.readU2();
        String descriptor = constantPool.resolveUtf8(descIndex);
        log.debug("Method {}{}, access flag: {}", name, descriptor, MethodAcc.toString(acc));
        List<AttributeInfo> attributes = attributeParser.readAttributes(in, Location.M);
        return new MethodInfo(MethodAcc.decode(acc), nameIndex, name, descIndex, descriptor, attributes);
    }
}
