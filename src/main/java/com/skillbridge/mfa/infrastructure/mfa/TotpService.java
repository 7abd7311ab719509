// ==============================================================================
// TOTP Engine - secret generation, provisioning material and code verification
// File: src/main/java/com/skillbridge/mfa/infrastructure/mfa/TotpService.java
// ==============================================================================

package com.skillbridge.mfa.infrastructure.mfa;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.skillbridge.mfa.config.MfaProperties;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.CodeVerifier;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import dev.samstevens.totp.time.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

@Service
public class TotpService {

    private static final Logger log = LoggerFactory.getLogger(TotpService.class);

    private static final HashingAlgorithm ALGORITHM = HashingAlgorithm.SHA1;

    // Configuration from application.yml
    private final String issuerName;
    private final int digits;
    private final int periodSeconds;
    private final int windowSize;
    private final int qrWidth;
    private final int qrHeight;

    private final SecretGenerator secretGenerator;
    private final TimeProvider timeProvider;
    private final CodeGenerator codeGenerator;
    private final CodeVerifier codeVerifier;

    public TotpService(MfaProperties properties, Clock clock) {
        MfaProperties.Totp totp = properties.getTotp();
        this.issuerName = totp.getIssuerName();
        this.digits = totp.getDigits();
        this.periodSeconds = totp.getPeriodSeconds();
        this.windowSize = totp.getWindow();
        this.qrWidth = properties.getQrCode().getWidth();
        this.qrHeight = properties.getQrCode().getHeight();

        this.secretGenerator = new DefaultSecretGenerator(totp.getSecretLength());
        this.timeProvider = () -> clock.instant().getEpochSecond();
        this.codeGenerator = new DefaultCodeGenerator(ALGORITHM, digits);
        this.codeVerifier = newVerifier(windowSize);

        log.info("TOTP Service initialized - Issuer: {}, Digits: {}, Period: {}s, Window: {}",
                issuerName, digits, periodSeconds, windowSize);
    }

    /**
     * Generate a new Base32 TOTP secret for user setup
     */
    public String generateSecret() {
        return secretGenerator.generate();
    }

    /**
     * Create the otpauth:// URI an authenticator app enrolls from
     */
    public String provisioningUri(String accountLabel, String secret) {
        return new QrData.Builder()
                .label(accountLabel)
                .secret(secret)
                .issuer(issuerName)
                .algorithm(ALGORITHM)
                .digits(digits)
                .period(periodSeconds)
                .build()
                .getUri();
    }

    /**
     * Render the provisioning URI as a PNG QR code
     */
    public byte[] qrImage(String uri) {
        try {
            BitMatrix bitMatrix = new QRCodeWriter().encode(uri, BarcodeFormat.QR_CODE, qrWidth, qrHeight);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(bitMatrix, "PNG", outputStream);

            log.debug("Generated QR code image of size: {} bytes", outputStream.size());
            return outputStream.toByteArray();
        } catch (WriterException | IOException e) {
            log.error("Failed to generate QR code: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to generate QR code", e);
        }
    }

    /**
     * Accepts the code for the current time step or any step within the configured window.
     */
    public boolean verifyCode(String secret, String submittedCode) {
        return verify(codeVerifier, secret, submittedCode);
    }

    public boolean verifyCode(String secret, String submittedCode, int toleranceSteps) {
        return verify(newVerifier(toleranceSteps), secret, submittedCode);
    }

    /**
     * Code for the time step containing {@code instant}.
     */
    public String codeAt(String secret, Instant instant) {
        try {
            return codeGenerator.generate(secret, Math.floorDiv(instant.getEpochSecond(), periodSeconds));
        } catch (CodeGenerationException e) {
            throw new IllegalStateException("Failed to generate TOTP code", e);
        }
    }

    private boolean verify(CodeVerifier verifier, String secret, String submittedCode) {
        if (secret == null || secret.isBlank() || submittedCode == null) {
            return false;
        }

        String cleanCode = submittedCode.trim();
        if (cleanCode.length() != digits || !cleanCode.chars().allMatch(Character::isDigit)) {
            log.debug("TOTP verification failed - invalid code format");
            return false;
        }

        // Comparison inside the verifier is constant-time
        return verifier.isValidCode(secret, cleanCode);
    }

    private CodeVerifier newVerifier(int toleranceSteps) {
        DefaultCodeVerifier verifier = new DefaultCodeVerifier(codeGenerator, timeProvider);
        verifier.setTimePeriod(periodSeconds);
        verifier.setAllowedTimePeriodDiscrepancy(toleranceSteps);
        return verifier;
    }
}
