package ideavalidator.domain.constants;

public class ModelRegex {
    public static final String LLAMA3_REGEX = "^llama3.*$";
    public static final String QWEN_REGEX = "^(hf.co/unsloth/)?(qwq|(q|Q)wen\\d(\\.\\d)?).*$";
    public static final String DEEPSEEK_REGEX = "^deepseek-r1.*$";
    public static final String PLAIN_REGEX = "^plain$";
}
