package org.tasktracker.annotation;

import org.tasktracker.service.Operation;

import java.lang.annotation.*;

/**
 * 标记接口对应的操作类别，由 GuardAspect 在方法执行前检查调用者角色。
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Guarded {
    Operation value();
}
