package dev.miniocpp.central.admin;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import dev.miniocpp.central.service.PointNotConnectedException;
import dev.miniocpp.protocol.rpc.CallErrorException;
import dev.miniocpp.protocol.rpc.CallFailedException;
import dev.miniocpp.protocol.rpc.CallTimeoutException;
import dev.miniocpp.protocol.rpc.ConnectionClosedException;

/**
 * Translates facade failures into explicit HTTP error responses.
 */
@RestControllerAdvice
public class AdminExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(AdminExceptionHandler.class);

	@ExceptionHandler(PointNotConnectedException.class)
	public ResponseEntity<Map<String, Object>> notConnected(PointNotConnectedException e) {
		return error(HttpStatus.NOT_FOUND, e.getMessage());
	}

	@ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class })
	public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
		String message = e instanceof HttpMessageNotReadableException ? "Invalid request body" : e.getMessage();
		return error(HttpStatus.BAD_REQUEST, message);
	}

	@ExceptionHandler(CallErrorException.class)
	public ResponseEntity<Map<String, Object>> callError(CallErrorException e) {
		logger.warn("Charge point answered {} with an error: {}", e.action(), e.getMessage());
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", e.getMessage());
		body.put("errorCode", e.errorCode());
		body.put("errorDescription", e.errorDescription());
		return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
	}

	@ExceptionHandler(CallTimeoutException.class)
	public ResponseEntity<Map<String, Object>> timeout(CallTimeoutException e) {
		logger.warn(e.getMessage());
		return error(HttpStatus.GATEWAY_TIMEOUT, e.getMessage());
	}

	@ExceptionHandler(ConnectionClosedException.class)
	public ResponseEntity<Map<String, Object>> connectionClosed(ConnectionClosedException e) {
		return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
	}

	@ExceptionHandler(CallFailedException.class)
	public ResponseEntity<Map<String, Object>> callFailed(CallFailedException e) {
		logger.error("Call to charge point failed", e);
		return error(HttpStatus.BAD_GATEWAY, e.getMessage());
	}

	private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", message);
		return ResponseEntity.status(status).body(body);
	}

}
