package by.greenmobile.productionplan.config;

import by.greenmobile.productionplan.controller.dto.ErrorResponse;
import by.greenmobile.productionplan.exception.InfeasibleDemandException;
import by.greenmobile.productionplan.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps engine and validation failures to HTTP responses. No plan is ever returned partially.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InfeasibleDemandException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse handleInfeasible(InfeasibleDemandException ex) {
        log.warn("Infeasible demand: {}", ex.getMessage());
        return new ErrorResponse("INFEASIBLE_DEMAND", ex.getMessage(), ex.getMissingMw());
    }

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleInvalid(InvalidInputException ex) {
        log.info("Invalid input: {}", ex.getMessage());
        return new ErrorResponse("INVALID_INPUT", ex.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleNotValid(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        log.info("Invalid input: {}", msg);
        return new ErrorResponse("INVALID_INPUT", msg, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return new ErrorResponse("INVALID_INPUT", "Malformed JSON request body", null);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUnexpected(Exception ex) {
        log.error("Error in plan calculation", ex);
        return new ErrorResponse("INTERNAL_ERROR", "Internal server error while calculating production plan", null);
    }

    private String describe(FieldError e) {
        return e.getField() + " " + e.getDefaultMessage();
    }
}
