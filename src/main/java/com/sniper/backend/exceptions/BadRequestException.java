package com.sniper.backend.exceptions;

/**
 * Entrada inválida: valores monetários negativos, número de parcelas menor que 1,
 * margem de segurança fora de 0-100 ou preço em formato não reconhecido.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
