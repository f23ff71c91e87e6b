package pin.runtime;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * 全局调试跟踪开关。
 *
 * <p>词法分析、语法分析和执行过程都通过 {@code java.util.logging} 记录跟踪信息：
 * FINE 为阶段和语句级，FINER 为逐个 token、逐次迭代和每次运算。
 * 打开开关时两个父 Logger {@code com.pinlang} 与 {@code pin} 放开全部级别并挂上控制台输出；
 * 关闭时恢复 INFO 级别并移除输出。可以在两次运行之间随时切换。</p>
 */
public final class PinTrace {

    private static final String[] ROOT_LOGGERS = {"com.pinlang", "pin"};

    /** 持有强引用，避免父 Logger 被回收后配置丢失 */
    private static final Logger[] LOGGERS = new Logger[ROOT_LOGGERS.length];

    private static Handler handler;
    private static volatile boolean enabled;

    static {
        for (int i = 0; i < ROOT_LOGGERS.length; i++) {
            LOGGERS[i] = Logger.getLogger(ROOT_LOGGERS[i]);
        }
    }

    private PinTrace() {}

    public static boolean isEnabled() {
        return enabled;
    }

    public static synchronized void setEnabled(boolean on) {
        if (on == enabled) {
            return;
        }
        if (on) {
            handler = new ConsoleHandler();
            handler.setLevel(Level.ALL);
            handler.setFormatter(new TraceFormatter());
            for (Logger logger : LOGGERS) {
                logger.setLevel(Level.ALL);
                logger.addHandler(handler);
            }
        } else {
            for (Logger logger : LOGGERS) {
                logger.setLevel(Level.INFO);
                logger.removeHandler(handler);
            }
            handler.close();
            handler = null;
        }
        enabled = on;
    }

    /**
     * 单行格式：{@code [调试] 简短类名: 消息}
     */
    static final class TraceFormatter extends Formatter {

        @Override
        public String format(LogRecord record) {
            String source = record.getLoggerName();
            if (source != null) {
                source = source.substring(source.lastIndexOf('.') + 1);
            }
            StringBuilder sb = new StringBuilder();
            sb.append("[调试] ").append(source).append(": ").append(formatMessage(record))
              .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(sw));
                sb.append(sw);
            }
            return sb.toString();
        }
    }
}
