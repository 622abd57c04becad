package io.physpage.memory;

public class Constants {
    public static final long KB = 1024L;
    public static final long MB = 1024L * KB;
    public static final long GB = 1024L * MB;
    public static final long MAX_ADDRESS = Long.MAX_VALUE - 1;
    public static final long DEFAULT_MAX_PHYSICAL_ADDRESS = (1L << 56) - 1;
}
