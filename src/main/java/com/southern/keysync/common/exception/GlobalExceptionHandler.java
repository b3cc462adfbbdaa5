package com.southern.keysync.common.exception;



import com.southern.keysync.common.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器，处理项目中抛出的业务异常和对账异常
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 捕获业务异常
     * @param ex
     * @return
     */
    @ExceptionHandler
    public Result<Void> exceptionHandler(BusinessException ex){
        log.error("业务异常信息：{}", ex.getMessage());
        return Result.error(ex.getMessage());
    }

    /**
     * 对账失败，run 已经被标记为 failed，这里只负责把原因返回给调用方
     */
    @ExceptionHandler
    public Result<Void> handleReconciliationException(ReconciliationException ex){
        log.error("对账异常信息：{}", ex.getMessage());
        return Result.error(ex.getMessage());
    }

    /**
     * 数据库访问异常
     */
    @ExceptionHandler
    public Result<Void> handleDataAccessException(DataAccessException ex){
        log.error("数据库异常信息：{}", ex.getMessage());
        return Result.error("数据库处理错误");
    }

    /**
     * 处理运行时异常
     * @param ex
     * @return
     */
    @ExceptionHandler
    public Result<Void> handleRuntimeException(RuntimeException ex){
        log.error("Runtime异常信息：{}", ex.getMessage(), ex);
        return Result.error("RuntimeException，请稍后再试");
    }

    /**
     * 捕获所有其他异常
     * @param ex
     * @return
     */
    @ExceptionHandler
    public Result<Void> handleException(Exception ex){
        log.error("异常信息：{}", ex.getMessage(), ex);
        return Result.error("未知错误");
    }


}
