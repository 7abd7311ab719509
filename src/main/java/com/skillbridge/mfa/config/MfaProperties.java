package com.skillbridge.mfa.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "app.mfa")
public class MfaProperties {
    private String masterSecret;
    private Kdf kdf = new Kdf();
    private Totp totp = new Totp();
    private QrCode qrCode = new QrCode();
    private RecoveryCodes recoveryCodes = new RecoveryCodes();
    private Challenge challenge = new Challenge();

    public String getMasterSecret() { return masterSecret; }
    public void setMasterSecret(String masterSecret) { this.masterSecret = masterSecret; }
    public Kdf getKdf() { return kdf; }
    public Totp getTotp() { return totp; }
    public QrCode getQrCode() { return qrCode; }
    public RecoveryCodes getRecoveryCodes() { return recoveryCodes; }
    public Challenge getChallenge() { return challenge; }

    public static class Kdf {
        private int iterations = 100_000;
        private String cipherSalt = "skillbridge_mfa_salt";
        private String recoverySalt = "skillbridge_recovery_salt";

        public int getIterations() { return iterations; }
        public void setIterations(int iterations) { this.iterations = iterations; }
        public String getCipherSalt() { return cipherSalt; }
        public void setCipherSalt(String cipherSalt) { this.cipherSalt = cipherSalt; }
        public String getRecoverySalt() { return recoverySalt; }
        public void setRecoverySalt(String recoverySalt) { this.recoverySalt = recoverySalt; }
    }

    public static class Totp {
        private String issuerName = "SkillBridge";
        private int digits = 6;
        private int periodSeconds = 30;
        private int window = 1;
        private int secretLength = 32;

        public String getIssuerName() { return issuerName; }
        public void setIssuerName(String issuerName) { this.issuerName = issuerName; }
        public int getDigits() { return digits; }
        public void setDigits(int digits) { this.digits = digits; }
        public int getPeriodSeconds() { return periodSeconds; }
        public void setPeriodSeconds(int periodSeconds) { this.periodSeconds = periodSeconds; }
        public int getWindow() { return window; }
        public void setWindow(int window) { this.window = window; }
        public int getSecretLength() { return secretLength; }
        public void setSecretLength(int secretLength) { this.secretLength = secretLength; }
    }

    public static class QrCode {
        private int width = 300;
        private int height = 300;

        public int getWidth() { return width; }
        public void setWidth(int width) { this.width = width; }
        public int getHeight() { return height; }
        public void setHeight(int height) { this.height = height; }
    }

    public static class RecoveryCodes {
        private int count = 10;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
    }

    public static class Challenge {
        private int maxAgeMinutes = 10;

        public int getMaxAgeMinutes() { return maxAgeMinutes; }
        public void setMaxAgeMinutes(int maxAgeMinutes) { this.maxAgeMinutes = maxAgeMinutes; }
    }
}
