package com.leadscore.utils.validation;

import com.leadscore.exceptions.BadRequestException;
import org.springframework.web.multipart.MultipartFile;

public final class FileValidationUtility {

    private FileValidationUtility() {
        throw new UnsupportedOperationException("Unsupported Operation");
    }

    public static void validateTable(MultipartFile file, String tableName) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("The " + tableName + " table cannot be null or empty");
        }
    }
}
