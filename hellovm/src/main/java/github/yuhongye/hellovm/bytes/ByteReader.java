package github.yuhongye.hellovm.bytes;

import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * class 文件中所有多字节数据都是大端序.
 * 每次读取要么拿到全部字节, 要么抛出 {@link ErrorCode#IO_ERROR}, 不会返回读了一半的数据.
 *
 * 顶层的 class 文件流和属性内部的字节数组共用这一个实现.
 */
public class ByteReader {
    private final DataInputStream in;

    /** 已经读取的字节数, 解释器把它当作 pc 使用 */
    private long position;

    public ByteReader(InputStream in) {
        this.in = in instanceof DataInputStream ? (DataInputStream) in : new DataInputStream(in);
    }

    /**
     * 在一段已经读出的字节上创建独立的游标, 用于解析属性内容和方法字节码
     */
    public static ByteReader of(byte[] bytes) {
        return new ByteReader(new ByteArrayInputStream(bytes));
    }

    public int readU1() {
        try {
            int v = in.readUnsignedByte();
            position += 1;
            return v;
        } catch (IOException e) {
            throw shortRead(1, e);
        }
    }

    public int readU2() {
        try {
            int v = in.readUnsignedShort();
            position += 2;
            return v;
        } catch (IOException e) {
            throw shortRead(2, e);
        }
    }

    /**
     * u4 可能超过 int 的范围, 用 long 返回
     */
    public long readU4() {
        return readS4() & 0xFFFFFFFFL;
    }

    public byte readS1() {
        try {
            byte v = in.readByte();
            position += 1;
            return v;
        } catch (IOException e) {
            throw shortRead(1, e);
        }
    }

    public short readS2() {
        try {
            short v = in.readShort();
            position += 2;
            return v;
        } catch (IOException e) {
            throw shortRead(2, e);
        }
    }

    public int readS4() {
        try {
            int v = in.readInt();
            position += 4;
            return v;
        } catch (IOException e) {
            throw shortRead(4, e);
        }
    }

    public long readS8() {
        try {
            long v = in.readLong();
            position += 8;
            return v;
        } catch (IOException e) {
            throw shortRead(8, e);
        }
    }

    public float readF4() {
        return Float.intBitsToFloat(readS4());
    }

    public double readF8() {
        return Double.longBitsToDouble(readS8());
    }

    public byte[] readBytes(int n) {
        if (n < 0) {
            throw VmException.of(ErrorCode.IO_ERROR, "negative length %d at offset %d", n, position);
        }
        byte[] bytes = new byte[n];
        try {
            in.readFully(bytes);
        } catch (IOException e) {
            throw shortRead(n, e);
        }
        position += n;
        return bytes;
    }

    /**
     * Constant_Utf8_info 的长度由调用方先读出来.
     * 注意: 这里按标准 UTF-8 解码, 而不是 DataInput#readUTF 的 modified UTF-8.
     * 非法的字节序列抛出 {@link ErrorCode#IO_ERROR}, 不会被替换成 U+FFFD
     */
    public String readUtf8(int length) {
        long start = position;
        byte[] bytes = readBytes(length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new VmException(ErrorCode.IO_ERROR, "invalid UTF-8 in " + length + " bytes at offset " + start, e);
        }
    }

    public long position() {
        return position;
    }

    /**
     * @return 还能读取的字节数, 对文件流来说只是一个估计值
     */
    public int remaining() {
        try {
            return in.available();
        } catch (IOException e) {
            throw new VmException(ErrorCode.IO_ERROR, "cannot query remaining bytes", e);
        }
    }

    public boolean isExhausted() {
        return remaining() == 0;
    }

    private VmException shortRead(int wanted, IOException e) {
        if (e instanceof EOFException) {
            return VmException.of(ErrorCode.IO_ERROR, "unexpected end of input, wanted %d bytes at offset %d",
                    wanted, position);
        }
        return new VmException(ErrorCode.IO_ERROR, "read failed at offset " + position, e);
    }
}
