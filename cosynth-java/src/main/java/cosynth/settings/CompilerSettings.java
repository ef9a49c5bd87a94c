package cosynth.settings;

import com.google.common.collect.ImmutableList;

import java.util.List;

public class CompilerSettings {

    static public IntegerSetting maxInlineDepth = new IntegerSetting() {
        @Override
        public String getKey() {
            return "max-inline-depth";
        }

        @Override
        public String getDescription() {
            return "Deepest nesting of inlined function calls before recursion is reported as unbounded.";
        }

        @Override
        public Integer defaultValue(Configuration configuration) {
            return 64;
        }
    };

    static public IntegerSetting maxStates = new IntegerSetting() {
        @Override
        public String getKey() {
            return "max-states";
        }

        @Override
        public String getDescription() {
            return "Largest state count a single synthesized state machine may reach.";
        }

        @Override
        public Integer defaultValue(Configuration configuration) {
            return 4096;
        }
    };

    static public IntegerSetting maxUnroll = new IntegerSetting() {
        @Override
        public String getKey() {
            return "max-unroll";
        }

        @Override
        public String getDescription() {
            return "Largest element count of a compile-time range or of a list a for loop unrolls.";
        }

        @Override
        public Integer defaultValue(Configuration configuration) {
            return 65536;
        }
    };

    static public OnOffSetting strictTemporaries = new OnOffSetting() {
        @Override
        public String getKey() {
            return "strict-temporaries";
        }

        @Override
        public String getDescription() {
            return "Reject named temporaries read in a state other than the one computing them.";
        }

        @Override
        public Boolean defaultValue(Configuration configuration) {
            return false;
        }
    };

    static public StringSetting bufferSuffix = new StringSetting() {
        @Override
        public String getKey() {
            return "buffer-suffix";
        }

        @Override
        public String getDescription() {
            return "Name suffix of the buffer signal added for every output port that is read.";
        }

        @Override
        public String defaultValue(Configuration configuration) {
            return "_buf";
        }
    };

    public static List<Setting<?>> all() {
        return ImmutableList.of(maxInlineDepth, maxStates, maxUnroll, strictTemporaries, bufferSuffix);
    }
}
