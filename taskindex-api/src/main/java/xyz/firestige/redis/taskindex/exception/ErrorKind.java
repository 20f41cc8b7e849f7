package xyz.firestige.redis.taskindex.exception;

/**
 * 错误类别
 *
 * <p>传输层按类别映射状态码：
 * <ul>
 *   <li>{@link #VALIDATION} → 400</li>
 *   <li>{@link #NOT_FOUND} → 404</li>
 *   <li>{@link #CONFLICT} → 409</li>
 *   <li>{@link #STORAGE} → 500</li>
 * </ul>
 *
 * @since 1.0
 */
public enum ErrorKind {

    /** 输入不合法，调用方可修正 */
    VALIDATION,

    /** 资源不存在或不属于当前 owner（两者不区分） */
    NOT_FOUND,

    /** 资源当前状态不允许该操作 */
    CONFLICT,

    /** 存储层无法完成原子批次或读取 */
    STORAGE
}
