package com.libragraph.keyfile.formats.xml;

/**
 * Element names and constants of the XML key file format.
 *
 * <pre>
 * &lt;?xml version="1.0" encoding="utf-8"?&gt;
 * &lt;KeyFile&gt;
 *     &lt;Meta&gt;
 *         &lt;Version&gt;1.00&lt;/Version&gt;
 *     &lt;/Meta&gt;
 *     &lt;Key&gt;
 *         &lt;Data&gt;ySFoKuCcJblw8ie6RkMBdVCnAf4EedSch7ItujK6bmI=&lt;/Data&gt;
 *     &lt;/Key&gt;
 * &lt;/KeyFile&gt;
 * </pre>
 */
public final class XmlKeyFileSchema {

    public static final String ROOT = "KeyFile";
    public static final String META = "Meta";
    public static final String VERSION = "Version";
    public static final String KEY = "Key";
    public static final String DATA = "Data";

    /** Version written into new files. Not checked on read. */
    public static final String CURRENT_VERSION = "1.00";

    /** Minimum element children of the root (Meta and Key). */
    public static final int MIN_ROOT_CHILDREN = 2;

    private XmlKeyFileSchema() {}
}
