package com.jdc.recipe_share.util;

import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;

import java.util.Base64;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code data:image/<subtype>;base64,<payload>} 문자열을 바이트와 확장자로 변환한다.
 */
public final class Base64ImageDecoder {

    private static final String DATA_URI_PREFIX = "data:";
    private static final Pattern DATA_URI =
            Pattern.compile("^data:image/([A-Za-z0-9.+-]+);base64,(.*)$", Pattern.DOTALL);

    private Base64ImageDecoder() {
    }

    public record DecodedImage(byte[] bytes, String extension) {
    }

    public static boolean isDataUri(String value) {
        return value != null && value.startsWith(DATA_URI_PREFIX);
    }

    public static DecodedImage decode(String dataUri) {
        if (dataUri == null) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE);
        }
        Matcher m = DATA_URI.matcher(dataUri.trim());
        if (!m.matches()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE, "data:image/...;base64, 형식이 아닙니다.");
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(m.group(2).replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE, e);
        }
        if (bytes.length == 0) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE, "이미지 데이터가 비어 있습니다.");
        }
        return new DecodedImage(bytes, extensionOf(m.group(1)));
    }

    // image/jpeg -> jpg, image/svg+xml -> svg
    public static String extensionOf(String subtype) {
        String ext = subtype.toLowerCase(Locale.ROOT);
        int plus = ext.indexOf('+');
        if (plus > 0) {
            ext = ext.substring(0, plus);
        }
        return "jpeg".equals(ext) ? "jpg" : ext;
    }
}
