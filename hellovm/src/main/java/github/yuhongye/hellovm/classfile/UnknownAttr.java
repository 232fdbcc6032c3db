package github.yuhongye.hellovm.classfile;

import com.google.common.io.BaseEncoding;

/**
 * 没有专门解析的属性, 原样保存 info 字节
 */
public class UnknownAttr extends AttributeInfo {
    private final byte[] bytes;

    public UnknownAttr(int nameIndex, String name, byte[] bytes) {
        super(nameIndex, name);
        this.bytes = bytes.clone();
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int getLength() {
        return bytes.length;
    }

    @Override
    public String toString() {
        return "UnknownAttr(" + getName() + ", " + BaseEncoding.base16().encode(bytes) + ")";
    }
}
