package com.phillippitts.aibakeoff.domain;

import java.util.List;

/**
 * Read-only seed data shared by all scenario runners.
 *
 * <p>Constructed once at startup. Lists are defensively copied and immutable, so a single
 * instance can be read by any number of concurrent tasks.
 */
public record BenchmarkInputs(List<TranslationPair> translationPairs, List<TtsPrompt> ttsPrompts) {

    public BenchmarkInputs {
        translationPairs = translationPairs == null ? List.of() : List.copyOf(translationPairs);
        ttsPrompts = ttsPrompts == null ? List.of() : List.copyOf(ttsPrompts);
    }

    /**
     * Billing-support phrases in five languages translated to English, plus one English
     * phrase translated to Spanish.
     */
    public static List<TranslationPair> defaultTranslationPairs() {
        return List.of(
                new TranslationPair("es", "en",
                        "Hola, necesito ayuda con mi factura. ¿Puedes verificar el saldo pendiente?"),
                new TranslationPair("fr", "en",
                        "Bonjour, j'ai une question sur ma facture. Le paiement n'a pas été enregistré."),
                new TranslationPair("pt", "en",
                        "Olá, preciso de ajuda com minha fatura. Você pode verificar o valor em aberto?"),
                new TranslationPair("ar", "en",
                        "مرحبًا، أحتاج إلى المساعدة في فاتورتي. هل يمكنك التحقق من المبلغ المستحق؟"),
                new TranslationPair("zh", "en",
                        "你好，我需要帮助处理我的账单。你能查一下未付余额吗？"),
                new TranslationPair("en", "es",
                        "Hello, I need help with my bill. Can you check the outstanding balance?")
        );
    }

    /**
     * The same call-greeting sentence in six languages.
     */
    public static List<TtsPrompt> defaultTtsPrompts() {
        return List.of(
                new TtsPrompt("en", "Thank you for calling. This is a performance benchmark of the voice system."),
                new TtsPrompt("es", "Gracias por llamar. Esta es una prueba de rendimiento del sistema de voz."),
                new TtsPrompt("fr", "Merci d'avoir appelé. Ceci est un test de performance du système vocal."),
                new TtsPrompt("pt", "Obrigado por ligar. Este é um teste de desempenho do sistema de voz."),
                new TtsPrompt("ar", "شكرًا لاتصالك. هذا اختبار أداء لنظام الصوت."),
                new TtsPrompt("zh", "感谢您的来电。这是语音系统的性能测试。")
        );
    }

    public static BenchmarkInputs defaults() {
        return new BenchmarkInputs(defaultTranslationPairs(), defaultTtsPrompts());
    }
}
