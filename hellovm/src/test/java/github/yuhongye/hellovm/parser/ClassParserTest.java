package github.yuhongye.hellovm.parser;

import github.yuhongye.hellovm.ClassFileBuilder;
import github.yuhongye.hellovm.bytes.ByteReader;
import github.yuhongye.hellovm.classfile.ClassAcc;
import github.yuhongye.hellovm.classfile.ClassFile;
import github.yuhongye.hellovm.classfile.CodeAttr;
import github.yuhongye.hellovm.classfile.LineNumber;
import github.yuhongye.hellovm.classfile.MethodAcc;
import github.yuhongye.hellovm.classfile.MethodInfo;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import github.yuhongye.hellovm.meta.JDKVersion;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.EnumSet;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ClassParserTest {
    private static final byte SENTINEL = 0x7F;

    @Test
    public void testEveryTagConsumesItsWidth() {
        assertWidth(ConstantTag.CONSTANT_UTF8_INFO, 1, 0, 3, 'a', 'b', 'c');
        assertWidth(ConstantTag.CONSTANT_INTEGER_INFO, 3, 0, 0, 0, 42);
        assertWidth(ConstantTag.CONSTANT_FLOAT_INFO, 4, 0x3F, 0x80, 0, 0);
        assertWidth(ConstantTag.CONSTANT_LONG_INFO, 5, 0, 0, 0, 0, 0, 0, 0, 1);
        assertWidth(ConstantTag.CONSTANT_DOUBLE_INFO, 6, 0x3F, 0xF0, 0, 0, 0, 0, 0, 0);
        assertWidth(ConstantTag.CONSTANT_CLASS_INFO, 7, 0, 1);
        assertWidth(ConstantTag.CONSTANT_STRING_INFO, 8, 0, 1);
        assertWidth(ConstantTag.CONSTANT_FIELDREF_INFO, 9, 0, 1, 0, 2);
        assertWidth(ConstantTag.CONSTANT_METHODREF_INFO, 10, 0, 1, 0, 2);
        assertWidth(ConstantTag.CONSTANT_INTERFACEMETHODREF_INFO, 11, 0, 1, 0, 2);
        assertWidth(ConstantTag.CONSTANT_NAMEANDTYPE_INFO, 12, 0, 1, 0, 2);
        assertWidth(ConstantTag.CONSTANT_METHODHANDLE_INFO, 15, 6, 0, 1);
        assertWidth(ConstantTag.CONSTANT_METHODTYPE_INFO, 16, 0, 1);
        assertWidth(ConstantTag.CONSTANT_INVOKEDYNAMIC_INFO, 18, 0, 0, 0, 2);
    }

    @Test
    public void testConstantValues() {
        assertEquals("abc", read(1, 0, 3, 'a', 'b', 'c').asUtf8());
        assertEquals(-2, read(3, 0xFF, 0xFF, 0xFF, 0xFE).asInt());
        assertEquals(1.0f, read(4, 0x3F, 0x80, 0, 0).asFloat(), 0f);
        assertEquals(1.0d, read(6, 0x3F, 0xF0, 0, 0, 0, 0, 0, 0).asDouble(), 0d);
        assertEquals(258, read(7, 1, 2).asClassNameIndex());
        assertEquals(new ConstVal.RefInfo(1, 2), read(10, 0, 1, 0, 2).asRef(ConstantTag.CONSTANT_METHODREF_INFO));
        assertEquals(new ConstVal.MethodHandleInfo(6, 1), read(15, 6, 0, 1).getVal());
    }

    @Test
    public void testMalformedUtf8Constant() {
        try {
            read(1, 0, 2, 0xC3, 0x28);
            fail("C3 28 is not valid UTF-8");
        } catch (VmException e) {
            assertEquals(ErrorCode.IO_ERROR, e.getCode());
        }
    }

    @Test
    public void testUnknownTag() {
        for (int tag : new int[] {0, 2, 13, 14, 17, 19, 255}) {
            ByteReader in = ByteReader.of(new byte[] {(byte) tag, SENTINEL, SENTINEL});
            try {
                ClassParser.readConstant(in);
                fail("tag " + tag + " is not valid");
            } catch (VmException e) {
                assertEquals(ErrorCode.MALFORMED_CONSTANT_POOL_TAG, e.getCode());
            }
            assertEquals(2, in.remaining());
        }
    }

    @Test
    public void testHelloWorld() {
        ClassFile classFile = parse(ClassFileBuilder.helloWorld("Hello, World!").build());

        assertTrue(classFile.hasValidMagic());
        assertEquals(52, classFile.getMajorVersion());
        assertEquals(0, classFile.getMinorVersion());
        assertEquals(JDKVersion.JAVA_8, classFile.getJdkVersion().get());
        assertEquals(EnumSet.of(ClassAcc.ACC_PUBLIC, ClassAcc.ACC_SUPER), classFile.getAccessFlags());
        assertEquals("Main", classFile.getThisClassName());
        assertEquals("java/lang/Object", classFile.getSuperClassName());

        assertEquals(1, classFile.getMethods().size());
        MethodInfo main = classFile.getMainMethod().get();
        assertEquals("([Ljava/lang/String;)V", main.getDescriptor());
        assertEquals(Arrays.asList(MethodAcc.ACC_PUBLIC, MethodAcc.ACC_STATIC), Arrays.asList(main.getAccessFlags().toArray()));

        CodeAttr code = main.getCode().get();
        assertEquals(2, code.getMaxStack());
        assertEquals(1, code.getMaxLocals());
        assertEquals(8, code.getCode().length);
        assertEquals(Arrays.asList(new LineNumber(0, 3), new LineNumber(8, 4)),
                code.getLineNumberTable().get().getLineNumbers());

        assertEquals("Main.java", classFile.getSourceFile().get().getSourceFile());
    }

    @Test
    public void testAccessFlagsKeepDeclarationOrder() {
        byte[] bytes = ClassFileBuilder.helloWorld("x").accessFlags(0x4000 | 0x0400 | 0x0001).build();
        ClassFile classFile = parse(bytes);
        assertEquals(Arrays.asList(ClassAcc.ACC_PUBLIC, ClassAcc.ACC_ABSTRACT, ClassAcc.ACC_ENUM),
                Arrays.asList(classFile.getAccessFlags().toArray()));
    }

    @Test
    public void testBadMagicIsKept() {
        ClassFile classFile = parse(ClassFileBuilder.helloWorld("x").magic(0xCAFEBABF).build());
        assertFalse(classFile.hasValidMagic());
    }

    @Test
    public void testInterfacesNotSupported() {
        byte[] bytes = ClassFileBuilder.helloWorld("x").interfacesCount(1).build();
        ByteReader in = ByteReader.of(bytes);
        try {
            new ClassParser(in).parse();
            fail("interfaces are not supported");
        } catch (VmException e) {
            assertEquals(ErrorCode.UNSUPPORTED_FEATURE, e.getCode());
        }
        // 接口下标 u2 还没有被读取
        assertEquals(bytes.length - firstInterfaceOffset(bytes), in.remaining());
    }

    @Test
    public void testFieldsNotSupported() {
        try {
            parse(ClassFileBuilder.helloWorld("x").fieldsCount(2).build());
            fail("fields are not supported");
        } catch (VmException e) {
            assertEquals(ErrorCode.UNSUPPORTED_FEATURE, e.getCode());
        }
    }

    @Test
    public void testTruncatedClassFile() {
        byte[] bytes = ClassFileBuilder.helloWorld("x").build();
        try {
            parse(Arrays.copyOf(bytes, bytes.length - 3));
            fail("class file is truncated");
        } catch (VmException e) {
            assertEquals(ErrorCode.IO_ERROR, e.getCode());
        }
    }

    @Test
    public void testLongConstantShiftsLaterIndexes() {
        ClassFileBuilder b = new ClassFileBuilder();
        int longIndex = b.longConstant(1L << 40);
        b.thisClass("Main").superClass("java/lang/Object");
        ClassFile classFile = parse(b.build());

        ConstantPool pool = classFile.getConstantPool();
        assertEquals(1, longIndex);
        assertEquals(1L << 40, pool.get(1).asLong());
        assertEquals("Main", classFile.getThisClassName());
        assertEquals("Main", pool.resolveUtf8(3));
        assertEquals(4, classFile.getThisClass());
        try {
            pool.get(2);
            fail("second slot of a long is not usable");
        } catch (VmException e) {
            assertEquals(ErrorCode.CONSTANT_POOL_INDEX_OUT_OF_RANGE, e.getCode());
        }
    }

    @Test
    public void testMethodNameMustBeUtf8() {
        ClassFileBuilder b = ClassFileBuilder.helloWorld("x");
        int classIndex = b.classRef("Other");
        byte[] bytes = b.build();
        // 把 main 的 name_index 改成一个 Class 常量, 它在 access_flags 之后
        int offset = methodsOffset(bytes) + 2;
        bytes[offset] = (byte) (classIndex >> 8);
        bytes[offset + 1] = (byte) classIndex;
        try {
            parse(bytes);
            fail();
        } catch (VmException e) {
            assertEquals(ErrorCode.CONSTANT_POOL_TYPE_MISMATCH, e.getCode());
        }
    }

    private static ClassFile parse(byte[] bytes) {
        return ClassParser.parse(new ByteArrayInputStream(bytes));
    }

    /**
     * 解析常量池之后 access_flags 开始的位置
     */
    private static int afterConstantPool(byte[] bytes) {
        ByteReader in = ByteReader.of(bytes);
        in.readBytes(8);
        new ClassParser(in).readConstantPool();
        return (int) in.position();
    }

    private static int firstInterfaceOffset(byte[] bytes) {
        // access_flags, this_class, super_class, interfaces_count
        return afterConstantPool(bytes) + 8;
    }

    private static int methodsOffset(byte[] bytes) {
        // access_flags, this_class, super_class, interfaces_count, fields_count, methods_count
        return afterConstantPool(bytes) + 12;
    }

    private static void assertWidth(ConstantTag expected, int tag, int... payload) {
        byte[] bytes = new byte[payload.length + 2];
        bytes[0] = (byte) tag;
        for (int i = 0; i < payload.length; i++) {
            bytes[i + 1] = (byte) payload[i];
        }
        bytes[bytes.length - 1] = SENTINEL;
        ByteReader in = ByteReader.of(bytes);
        ConstVal val = ClassParser.readConstant(in);
        assertEquals(expected, val.getTag());
        assertEquals(1, in.remaining());
        assertEquals(SENTINEL, in.readS1());
    }

    private static ConstVal read(int tag, int... payload) {
        byte[] bytes = new byte[payload.length + 1];
        bytes[0] = (byte) tag;
        for (int i = 0; i < payload.length; i++) {
            bytes[i + 1] = (byte) payload[i];
        }
        return ClassParser.readConstant(ByteReader.of(bytes));
    }
}
