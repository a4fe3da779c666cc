package guraa.renderverify.visual;

/**
 * Which colour channels contribute to the per-pixel error.
 */
public enum ChannelCompareMode {
    ARGB,
    RGB
}
