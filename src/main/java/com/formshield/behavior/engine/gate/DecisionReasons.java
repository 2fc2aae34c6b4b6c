package com.formshield.behavior.engine.gate;

/**
 * Reason and recommendation strings returned to callers. Callers match on these, so they are stable.
 */
public final class DecisionReasons {

    public static final String HONEYPOT_FILLED = "honeypot filled";
    public static final String INSUFFICIENT_TRACKING_TIME = "insufficient tracking time";
    public static final String FILLED_TOO_QUICKLY = "form filled too quickly";
    public static final String INSUFFICIENT_MOUSE_MOVEMENT = "insufficient mouse movement";
    public static final String BOT_BEHAVIOR = "bot behavior detected";
    public static final String HUMAN_VERIFIED = "human verified";
    public static final String ENHANCED_PASSED = "enhanced verification passed";
    public static final String ENHANCED_INSUFFICIENT = "enhanced verification insufficient";
    public static final String LEVEL_INSUFFICIENT = "verification level insufficient";

    public static final String RECOMMEND_BLOCK_AUTOMATED = "block submission - likely automated";
    public static final String RECOMMEND_LONGER_INTERACTION = "require longer interaction time";
    public static final String RECOMMEND_CAPTCHA_OR_VERIFICATION = "show CAPTCHA or additional verification";
    public static final String RECOMMEND_MOUSE_INTERACTION = "request mouse interaction";
    public static final String RECOMMEND_BLOCK_BEHAVIOR = "block submission - behavioral analysis failed";
    public static final String RECOMMEND_CAPTCHA = "show CAPTCHA";
    public static final String RECOMMEND_CAPTCHA_OR_CHALLENGES = "show CAPTCHA or additional challenges";

    private DecisionReasons() {
    }
}
