package fr.imt.scanzilla.scanzilla.presentation.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every API response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HttpResponse<T> {

    private boolean success;
    private T data;
    private String error;
    private String message;

    public static <T> HttpResponse<T> success(T data) {
        return new HttpResponse<>(true, data, null, null);
    }

    public static <T> HttpResponse<T> error(String error) {
        return new HttpResponse<>(false, null, error, null);
    }

    public static <T> HttpResponse<T> error(String error, String message) {
        return new HttpResponse<>(false, null, error, message);
    }
}
