package com.givehub.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.modules.auth.domain.OneTimeCode;
import com.givehub.backend.modules.auth.domain.OtpPurpose;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.infrastructure.persistence.OneTimeCodeRepository;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.auth.presentation.dto.OtpIssuedResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies six-digit one-time codes. Delivery is out of scope; codes are only logged,
 * and echoed back when {@code app.otp.expose-code} is enabled.
 */
@Service
public class OneTimeCodeService {

    private static final Logger log = LoggerFactory.getLogger(OneTimeCodeService.class);
    private static final int CODE_BOUND = 900_000;
    private static final int CODE_OFFSET = 100_000;

    private final OneTimeCodeRepository oneTimeCodeRepository;
    private final UserAccountRepository userAccountRepository;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final long ttlMinutes;
    private final boolean exposeCode;
    private final SecureRandom random = new SecureRandom();

    public OneTimeCodeService(
            OneTimeCodeRepository oneTimeCodeRepository,
            UserAccountRepository userAccountRepository,
            UnitOfWork unitOfWork,
            Clock clock,
            @Value("${app.otp.ttl-minutes:10}") long ttlMinutes,
            @Value("${app.otp.expose-code:false}") boolean exposeCode
    ) {
        this.oneTimeCodeRepository = oneTimeCodeRepository;
        this.userAccountRepository = userAccountRepository;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
        this.ttlMinutes = ttlMinutes;
        this.exposeCode = exposeCode;
    }

    public OtpIssuedResponse issueCode(String rawEmail, OtpPurpose purpose) {
        if (!StringUtils.hasText(rawEmail) || purpose == null) {
            throw ProblemException.validation("otp.missing_fields", "Email and purpose are required");
        }
        String email = AuthService.normalizeEmail(rawEmail);
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusMinutes(ttlMinutes);
        String code = String.valueOf(CODE_OFFSET + random.nextInt(CODE_BOUND));

        unitOfWork.run("otp.issue", () -> {
            UserAccount user = userAccountRepository.findByEmailIgnoreCase(email).orElse(null);
            oneTimeCodeRepository.save(new OneTimeCode(user, email, code, purpose, expiresAt));
        });

        log.debug("Issued one-time code purpose={} email={} code={}", purpose, email, code);
        return new OtpIssuedResponse("OTP sent to email", expiresAt, exposeCode ? code : null);
    }

    public void verifyCode(String rawEmail, String code, OtpPurpose purpose) {
        if (!StringUtils.hasText(rawEmail) || !StringUtils.hasText(code) || purpose == null) {
            throw ProblemException.validation("otp.missing_fields", "Email, code and purpose are required");
        }
        String email = AuthService.normalizeEmail(rawEmail);
        unitOfWork.run("otp.verify", () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            OneTimeCode otp = oneTimeCodeRepository.findUsableForUpdate(email, code.trim(), purpose, now).stream()
                    .filter(candidate -> candidate.isUsableAt(now))
                    .findFirst()
                    .orElseThrow(() -> ProblemException.validation("otp.invalid", "Invalid or expired OTP"));
            otp.markUsed();
        });
    }

    public int purgeExpired() {
        return unitOfWork.execute("otp.purgeExpired",
                () -> oneTimeCodeRepository.deleteExpired(OffsetDateTime.now(clock)));
    }
}
