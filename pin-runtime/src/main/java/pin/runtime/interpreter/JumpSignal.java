package pin.runtime.interpreter;

/**
 * 跳转信号：由 tiao 语句产生，经 panduan / xunhuan 原样向上传递，
 * 只在顶层分派循环里才真正改变执行位置。
 *
 * <p>语句执行返回 null 表示顺序执行下一条。</p>
 */
public final class JumpSignal {

    private final String targetName;

    public JumpSignal(String targetName) {
        this.targetName = targetName;
    }

    public String getTargetName() {
        return targetName;
    }

    @Override
    public String toString() {
        return "JumpSignal(target='" + targetName + "')";
    }
}
