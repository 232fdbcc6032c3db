package github.yuhongye.hellovm.parser;

import com.google.common.base.Preconditions;
import github.yuhongye.hellovm.bytes.ByteReader;
import github.yuhongye.hellovm.classfile.AttributeInfo;
import github.yuhongye.hellovm.classfile.AttributeType;
import github.yuhongye.hellovm.classfile.AttributeType.Location;
import github.yuhongye.hellovm.classfile.CodeAttr;
import github.yuhongye.hellovm.classfile.ConstantValueAttr;
import github.yuhongye.hellovm.classfile.ExceptionEntry;
import github.yuhongye.hellovm.classfile.LineNumber;
import github.yuhongye.hellovm.classfile.LineNumberTableAttr;
import github.yuhongye.hellovm.classfile.SourceFileAttr;
import github.yuhongye.hellovm.classfile.UnknownAttr;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析 attribute_info. 属性名需要通过常量池解析, 所以常量池必须在这之前构建完成.
 * 每个属性的 info 先整体读出来, 再在独立的游标上解析, 解析结束时游标必须恰好读完.
 */
@Slf4j
public class AttributeParser {
    private final ConstantPool constantPool;

    public AttributeParser(ConstantPool constantPool) {
        this.constantPool = Preconditions.checkNotNull(constantPool);
    }

    public List<AttributeInfo> readAttributes(ByteReader in, Location where) {
        int count = in.readU2();
        log.debug("Attributes count: {}", count);
        List<AttributeInfo> attributes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            attributes.add(readAttribute(in, where));
        }
        return attributes;
    }

    /**
     * Attribute结构的第一个字段都是attribute_name_index，它必须是对常量池的一个有效索引,
     * 并且该常量必须是Constant_Utf8_info结构. 属性名决定了 info 的结构, 所以解析不出来就直接失败.
     */
    public AttributeInfo readAttribute(ByteReader in, Location where) {
        int nameIndex = in.readU2();
        String name = constantPool.resolveUtf8(nameIndex);
        long length = in.readU4();
        if (length > Integer.MAX_VALUE) {
            throw VmException.of(ErrorCode.ATTRIBUTE_LENGTH_MISMATCH, "%s declares %d bytes", name, length);
        }
        log.debug("\tattribute name: {}, length: {}", name, length);

        byte[] info = in.readBytes((int) length);
        ByteReader body = ByteReader.of(info);

        AttributeType type = AttributeType.getByName(name).orElse(null);
        if (type != null && !type.isAllowedIn(where)) {
            log.warn("Attribute {} is not expected in {}", name, where);
        }

        AttributeInfo attribute;
        if (type == AttributeType.CONSTANT_VALUE) {
            attribute = new ConstantValueAttr(nameIndex, name, body.readU2());
        } else if (type == AttributeType.CODE) {
            attribute = readCode(nameIndex, name, body);
        } else if (type == AttributeType.SOURCE_FILE) {
            int sourceFileIndex = body.readU2();
            attribute = new SourceFileAttr(nameIndex, name, sourceFileIndex, constantPool.resolveUtf8(sourceFileIndex));
        } else if (type == AttributeType.LINE_NUMBER_TABLE) {
            attribute = readLineNumberTable(nameIndex, name, body);
        } else {
            if (type == null) {
                log.warn("Unrecognized attribute {}, keep {} bytes as is", name, length);
            } else {
                log.debug("Attribute {} is not decoded, keep {} bytes as is", name, length);
            }
            return new UnknownAttr(nameIndex, name, info);
        }

        int left = body.remaining();
        if (left != 0) {
            throw VmException.of(ErrorCode.ATTRIBUTE_LENGTH_MISMATCH, "%s declares %d bytes but %d were not consumed",
                    name, length, left);
        }
        return attribute;
    }

    private CodeAttr readCode(int nameIndex, String name, ByteReader in) {
        int maxStack = in.readU2();
        int maxLocals = in.readU2();
        long codeLength = in.readU4();
        if (codeLength > in.remaining()) {
            throw VmException.of(ErrorCode.IO_ERROR, "code_length %d exceeds the Code attribute", codeLength);
        }
        byte[] code = in.readBytes((int) codeLength);
        log.debug("Code: max_stack={}, max_locals={}, code_length={}", maxStack, maxLocals, codeLength);

        int exceptionTableLength = in.readU2();
        List<ExceptionEntry> exceptionTable = new ArrayList<>(exceptionTableLength);
        for (int i = 0; i < exceptionTableLength; i++) {
            exceptionTable.add(new ExceptionEntry(in.readU2(), in.readU2(), in.readU2(), in.readU2()));
        }

        List<AttributeInfo> attributes = readAttributes(in, Location.CODE);
        return new CodeAttr(nameIndex, name, maxStack, maxLocals, code, exceptionTable, attributes);
    }

    private LineNumberTableAttr readLineNumberTable(int nameIndex, String name, ByteReader in) {
        int length = in.readU2();
        List<LineNumber> lineNumbers = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            lineNumbers.add(new LineNumber(in.readU2(), in.readU2()));
        }
        return new LineNumberTableAttr(nameIndex, name, lineNumbers);
    }
}
