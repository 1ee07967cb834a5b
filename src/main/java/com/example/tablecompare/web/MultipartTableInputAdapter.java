package com.example.tablecompare.web;

import com.example.tablecompare.domain.TableInput;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@Component
public class MultipartTableInputAdapter {
    private static final int SNIFF_LENGTH = 8192;

    /**
     * Wraps an upload as a {@link TableInput}. A zero-byte upload is accepted and parses to an
     * empty table; binary content such as archives or spreadsheets is rejected.
     */
    public TableInput adapt(MultipartFile file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("File must be provided");
        }
        if (isBinary(file)) {
            throw new IllegalArgumentException(
                    "File " + describeFilename(file) + " is not a delimited text file");
        }
        return new TableInput(sanitizeFilename(file.getOriginalFilename()), file::getInputStream);
    }

    public String describeFilename(MultipartFile file) {
        if (file == null) {
            return "no file";
        }
        String name = sanitizeFilename(file.getOriginalFilename());
        return name.isEmpty() ? "upload" : name;
    }

    public String describeComparison(MultipartFile original, MultipartFile updated) {
        return String.format("%s vs %s", describeFilename(original), describeFilename(updated));
    }

    private String sanitizeFilename(String originalFilename) {
        if (originalFilename == null) {
            return "";
        }
        String normalized = originalFilename.replace('\\', '/').trim();
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private boolean isBinary(MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            return false;
        }
        try (InputStream inputStream = file.getInputStream()) {
            byte[] head = inputStream.readNBytes(SNIFF_LENGTH);
            if (head.length >= 4) {
                int header = ((head[0] & 0xFF) << 24)
                        | ((head[1] & 0xFF) << 16)
                        | ((head[2] & 0xFF) << 8)
                        | (head[3] & 0xFF);
                // zip container, which includes xlsx
                if (header == 0x504B0304 || header == 0x504B0506 || header == 0x504B0708) {
                    return true;
                }
            }
            for (byte b : head) {
                if (b == 0) {
                    return true;
                }
            }
            return false;
        }
    }
}
