package com.github.salilvnair.funnelengine.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String FUNNEL_ID = "niche-funnel";
    public static final String SCOPE = "exp_123";
    public static final String USER_REF = "user_42";

    public static final String STAGE_WELCOME = "WELCOME";
    public static final String STAGE_VALUE = "VALUE_DELIVERY";
    public static final String STAGE_TRANSITION = "TRANSITION";
    public static final String STAGE_OFFER = "OFFER";

    public static final String BLOCK_WELCOME = "welcome";
    public static final String BLOCK_VALUE_ECOM = "value_ecom";
    public static final String BLOCK_VALUE_COACH = "value_coach";
    public static final String BLOCK_TRANSITION = "transition";
    public static final String BLOCK_OFFER = "offer";

    public static final String BLOCK_A = "A";
    public static final String BLOCK_B = "B";
    public static final String BLOCK_C = "C";

    public static final String OPTION_ECOM = "E-commerce";
    public static final String OPTION_COACHING = "Coaching";
    public static final String OPTION_DONE = "Done";
    public static final String OPTION_YES = "Yes";
    public static final String OPTION_START_OVER = "Start over";
    public static final String OPTION_THANKS = "Thanks";

    public static final String RESOURCE_GUIDE = "Guide";
    public static final String RESOURCE_PLAYBOOK = "Playbook";
    public static final String RESOURCE_AFFILIATE = "Affiliate";

    public static final String GUIDE_RAW_LINK = "https://x/y";
    public static final String GUIDE_TAGGED_LINK = "https://x/y?app=exp_123";
    public static final String AFFILIATE_RAW_LINK = "https://whop.com/offer?ref=partner7";
    public static final String FALLBACK_URL = "https://whop.com/apps";

    public static final String INPUT_ONE = "1";
    public static final String INPUT_TWO = "2";
    public static final String INPUT_GARBAGE = "banana";
}
