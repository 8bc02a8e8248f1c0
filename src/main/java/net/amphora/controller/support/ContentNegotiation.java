package net.amphora.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

/**
 * Picks the response format for a request from its {@code Accept} header, or from
 * the media type a URL extension forced onto the request.
 */
public final class ContentNegotiation {

    static final String FORCED_MEDIA_TYPE_ATTRIBUTE = ContentNegotiation.class.getName() + ".FORCED";

    private ContentNegotiation() {
    }

    public enum Format {
        JSON,
        HTML,
        OTHER
    }

    /**
     * Overrides the request's {@code Accept} header for the rest of the request.
     */
    public static void force(HttpServletRequest request, MediaType mediaType) {
        request.setAttribute(FORCED_MEDIA_TYPE_ATTRIBUTE, mediaType);
    }

    /**
     * Walks the accepted types by descending quality (header order on ties) and
     * returns the first of JSON or HTML they admit. A missing header admits JSON.
     */
    public static Format resolve(HttpServletRequest request) {
        Object forced = request.getAttribute(FORCED_MEDIA_TYPE_ATTRIBUTE);
        if (forced instanceof MediaType mediaType) {
            return resolve(List.of(mediaType));
        }
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        if (!StringUtils.hasText(accept)) {
            return Format.JSON;
        }
        try {
            return resolve(MediaType.parseMediaTypes(accept));
        } catch (InvalidMediaTypeException ex) {
            return Format.OTHER;
        }
    }

    static Format resolve(List<MediaType> accepted) {
        List<MediaType> ordered = new ArrayList<>(accepted);
        ordered.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
        for (MediaType mediaType : ordered) {
            if (mediaType.getQualityValue() <= 0) {
                continue;
            }
            if (mediaType.includes(MediaType.APPLICATION_JSON)) {
                return Format.JSON;
            }
            if (mediaType.includes(MediaType.TEXT_HTML)) {
                return Format.HTML;
            }
        }
        return Format.OTHER;
    }
}
