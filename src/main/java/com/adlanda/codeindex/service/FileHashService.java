package com.adlanda.codeindex.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Service for computing file content hashes.
 *
 * The hash is stored on the file row as an audit field once all of its
 * chunks are written. It is not used to decide what to re-index.
 */
@Service
public class FileHashService {

    /**
     * Computes the SHA-256 hash of decoded file content (hashed as UTF-8).
     *
     * @param content The file content
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
