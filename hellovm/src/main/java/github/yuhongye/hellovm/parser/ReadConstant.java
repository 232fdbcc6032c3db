package github.yuhongye.hellovm.parser;

/**
 * 读取某一种 tag 之后的常量内容
 * @param <I> 输入
 * @param <V> 读出来的常量
 */
@FunctionalInterface
public interface ReadConstant<I, V> {
    V read(I in);
}
